/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.registry;

import com.sitepulse.realtime.channel.ChannelKey;

/**
 * Token for one callback registered with a {@link SubscriptionRegistry}.
 * Releasing the same token twice is harmless.
 */
public final class Registration {

    private final ChannelKey key;
    private final long id;

    Registration(ChannelKey key, long id) {
        this.key = key;
        this.id = id;
    }

    public ChannelKey key() { return key; }

    public long id() { return id; }

    @Override
    public String toString() {
        return "Registration{" + key.channelName() + "#" + id + "}";
    }
}
