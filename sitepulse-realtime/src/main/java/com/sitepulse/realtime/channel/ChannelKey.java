/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Identifies what a channel watches: a resource, an optional equality filter and
 * an event class.
 *
 * <p>Filter fields are trimmed and values are normalised to strings, held in a
 * sorted, unmodifiable map, so two keys built from the same pairs in a different
 * order are equal and share one channel. Null filter values are rejected rather
 * than turned into the text {@code "null"}. A missing event class is
 * {@link EventClass#ANY}.
 *
 * @param resource   backend collection name, never blank
 * @param filter     field to expected value, possibly empty
 * @param eventClass change class to receive
 */
public record ChannelKey(String resource, Map<String, String> filter, EventClass eventClass) {

    public ChannelKey {
        Objects.requireNonNull(resource, "resource must not be null");
        if (resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be blank");
        }
        resource = resource.trim();
        filter = filter == null || filter.isEmpty()
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(canonical(filter));
        eventClass = eventClass == null ? EventClass.ANY : eventClass;
    }

    public static ChannelKey of(String resource) {
        return new ChannelKey(resource, null, EventClass.ANY);
    }

    public static ChannelKey of(String resource, Map<String, ?> filter, EventClass eventClass) {
        return new ChannelKey(resource, normalise(filter), eventClass);
    }

    public static Builder builder(String resource) { return new Builder(resource); }

    public boolean hasFilter() { return !filter.isEmpty(); }

    /**
     * Human-readable channel name, e.g. {@code tasks:project_id=eq.P1:*}.
     * Used for logging and diagnostics only; equality is structural.
     */
    public String channelName() {
        StringBuilder sb = new StringBuilder(resource);
        if (hasFilter()) {
            sb.append(':').append(filter.entrySet().stream()
                    .map(e -> e.getKey() + "=eq." + e.getValue())
                    .collect(Collectors.joining(",")));
        }
        return sb.append(':').append(eventClass.wireName()).toString();
    }

    @Override
    public String toString() { return channelName(); }

    private static Map<String, String> normalise(Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) return null;
        Map<String, String> out = new LinkedHashMap<>();
        filter.forEach((field, value) -> {
            if (value == null) {
                throw new IllegalArgumentException("filter value for '" + field + "' must not be null");
            }
            out.put(field, String.valueOf(value));
        });
        return out;
    }

    private static TreeMap<String, String> canonical(Map<String, String> filter) {
        TreeMap<String, String> out = new TreeMap<>();
        filter.forEach((field, value) -> {
            Objects.requireNonNull(field, "filter field must not be null");
            if (field.isBlank()) {
                throw new IllegalArgumentException("filter field must not be blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("filter value for '" + field + "' must not be null");
            }
            if (out.put(field.trim(), value) != null) {
                throw new IllegalArgumentException("filter field '" + field.trim() + "' is given twice");
            }
        });
        return out;
    }

    public static class Builder {
        private final String resource;
        private final Map<String, Object> filter = new TreeMap<>();
        private EventClass eventClass = EventClass.ANY;

        private Builder(String resource) { this.resource = resource; }

        public Builder where(String field, Object value) {
            filter.put(field, value); return this;
        }
        public Builder filter(Map<String, ?> values) {
            if (values != null) filter.putAll(values);
            return this;
        }
        public Builder event(EventClass eventClass) {
            this.eventClass = eventClass; return this;
        }
        public Builder event(String eventClass) {
            this.eventClass = EventClass.parse(eventClass); return this;
        }

        public ChannelKey build() { return ChannelKey.of(resource, filter, eventClass); }
    }
}
