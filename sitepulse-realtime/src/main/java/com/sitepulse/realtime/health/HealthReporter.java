/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.health;

import com.sitepulse.common.util.JsonUtil;
import com.sitepulse.realtime.channel.ConnectionState;
import com.sitepulse.realtime.registry.SubscriptionRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link HealthSnapshot}s from the live state of a {@link SubscriptionRegistry}.
 * Nothing is cached; every call walks the registry.
 */
public class HealthReporter {

    private final SubscriptionRegistry registry;

    public HealthReporter(SubscriptionRegistry registry) {
        this.registry = registry;
    }

    public HealthSnapshot snapshot() {
        List<ChannelInfo> channels = registry.channelInfo();
        int active = 0;
        int total = 0;
        int subscribed = 0;
        int errored = 0;
        for (ChannelInfo info : channels) {
            total += info.subscriberCount();
            if (info.subscriberCount() > 0) active++;
            if (info.state() == ConnectionState.SUBSCRIBED) subscribed++;
            if (info.isFailing()) errored++;
        }

        HealthCounters counters = registry.counters();
        int maxChannels = registry.getConfig().getMaxChannels();
        Instant now = registry.clock().instant();
        return new HealthSnapshot(
                active,
                total,
                counters.getReconnectionAttempts(),
                counters.getConnectionErrors(),
                now,
                subscribed,
                errored,
                counters.getCallbackFailures(),
                counters.getEventsReceived(),
                counters.getEventsDropped(),
                maxChannels,
                active + "/" + maxChannels,
                errored == 0,
                Duration.between(registry.startedAt(), now));
    }

    /** The current snapshot as JSON, for status endpoints and log lines. */
    public String snapshotJson() {
        return JsonUtil.toJson(snapshot());
    }

    /** Snapshot plus per-channel detail, in the shape a status page renders. */
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", registry.getConfig().getName());
        status.put("health", snapshot());
        status.put("channels", registry.channelInfo());
        return status;
    }

    public HealthCounters counters() {
        return registry.counters();
    }
}
