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

import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.channel.ConnectionState;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one channel, for diagnostics.
 *
 * @param key             channel key
 * @param channelName     rendered key, e.g. {@code tasks:project_id=eq.P1:*}
 * @param state           connection state
 * @param subscriberCount registered callbacks
 * @param attempt         consecutive failures since the last successful open
 * @param exhausted       true when closed because the retry budget ran out
 * @param lastError       last failure description, or null
 * @param createdAt       when the channel was created
 * @param subscribedAt    when it last reached SUBSCRIBED, or null
 * @param uptime          time since creation
 */
public record ChannelInfo(
        ChannelKey key,
        String channelName,
        ConnectionState state,
        int subscriberCount,
        int attempt,
        boolean exhausted,
        String lastError,
        Instant createdAt,
        Instant subscribedAt,
        Duration uptime
) {
    /** In ERROR, or CLOSED after running out of retries. */
    public boolean isFailing() {
        return state == ConnectionState.ERROR || exhausted;
    }
}
