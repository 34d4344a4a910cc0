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
 * Callback registered against a channel.
 *
 * <p>Each subscriber receives events in arrival order on its own delivery lane;
 * one slow or failing handler does not hold up the others.
 */
@FunctionalInterface
public interface ChangeHandler {

    /**
     * Called for each change on the subscribed channel.
     *
     * @param event the change, never null
     */
    void onChange(ChangeEvent event);
}
