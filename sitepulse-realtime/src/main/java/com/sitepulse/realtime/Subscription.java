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

import com.sitepulse.realtime.channel.ChannelKey;

/**
 * Handle returned by {@link SubscriberFacade#subscribe}. Unsubscribing more than
 * once has no further effect.
 */
public interface Subscription extends AutoCloseable {

    ChannelKey key();

    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }

    /** A subscription that was never registered, e.g. after shutdown. */
    static Subscription inactive(ChannelKey key) {
        return new Subscription() {
            @Override
            public ChannelKey key() { return key; }

            @Override
            public void unsubscribe() {}

            @Override
            public boolean isActive() { return false; }

            @Override
            public String toString() { return "Subscription{" + key + ", inactive}"; }
        };
    }
}
