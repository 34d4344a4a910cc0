/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime;

import com.sitepulse.realtime.channel.EventClass;
import com.sitepulse.realtime.channel.StateChangeListener;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional parts of a subscription by resource name.
 *
 * <pre>{@code
 *   facade.subscribe("tasks", this::onTask, SubscribeOptions.builder()
 *       .where("project_id", projectId)
 *       .event("update")
 *       .onStateChange((state, error) -> banner.show(state))
 *       .build());
 * }</pre>
 */
public final class SubscribeOptions {

    private static final SubscribeOptions NONE = builder().build();

    private final Map<String, Object> filter;
    private final EventClass event;
    private final StateChangeListener onStateChange;

    private SubscribeOptions(Builder b) {
        this.filter = Collections.unmodifiableMap(new LinkedHashMap<>(b.filter));
        this.event = b.event;
        this.onStateChange = b.onStateChange;
    }

    public static SubscribeOptions none() { return NONE; }

    public static Builder builder() { return new Builder(); }

    public Map<String, Object> filter() { return filter; }
    public EventClass event() { return event; }
    public StateChangeListener onStateChange() { return onStateChange; }

    public static class Builder {
        private final Map<String, Object> filter = new LinkedHashMap<>();
        private EventClass event = EventClass.ANY;
        private StateChangeListener onStateChange;

        public Builder where(String field, Object value) {
            filter.put(field, value); return this;
        }
        public Builder filter(Map<String, ?> values) {
            if (values != null) filter.putAll(values);
            return this;
        }
        public Builder event(EventClass event) {
            this.event = event; return this;
        }
        public Builder event(String event) {
            this.event = EventClass.parse(event); return this;
        }
        public Builder onStateChange(StateChangeListener listener) {
            this.onStateChange = listener; return this;
        }

        public SubscribeOptions build() { return new SubscribeOptions(this); }
    }
}
