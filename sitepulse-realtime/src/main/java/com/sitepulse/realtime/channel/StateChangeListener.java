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

/**
 * Optional observer of a channel's connection state, passed alongside the
 * change handler.
 */
@FunctionalInterface
public interface StateChangeListener {

    /**
     * @param state new state of the channel
     * @param error description of the failure for ERROR and exhausted CLOSED, otherwise null
     */
    void onStateChange(ConnectionState state, String error);
}
