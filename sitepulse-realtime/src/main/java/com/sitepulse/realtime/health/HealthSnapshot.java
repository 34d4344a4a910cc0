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

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only summary of a registry's state, computed on demand.
 *
 * @param activeChannels       channels with at least one subscriber
 * @param totalSubscriptions   subscribers summed across all channels
 * @param reconnectionAttempts retries started since the registry was created
 * @param connectionErrors     failed opens and dropped channels since creation
 * @param lastHealthCheck      when this snapshot was taken
 * @param subscribedChannels   channels currently SUBSCRIBED
 * @param erroredChannels      channels in ERROR or exhausted
 * @param callbackFailures     subscriber callbacks that threw
 * @param eventsReceived       change events received from the backend
 * @param eventsDropped        deliveries dropped because a subscriber lane was full
 * @param maxChannels          configured soft channel limit
 * @param channelUtilization   {@code "active/max"}
 * @param healthy              no channel is failing
 * @param uptime               time since the registry was created
 */
public record HealthSnapshot(
        int activeChannels,
        int totalSubscriptions,
        long reconnectionAttempts,
        long connectionErrors,
        Instant lastHealthCheck,
        int subscribedChannels,
        int erroredChannels,
        long callbackFailures,
        long eventsReceived,
        long eventsDropped,
        int maxChannels,
        String channelUtilization,
        boolean healthy,
        Duration uptime
) {}
