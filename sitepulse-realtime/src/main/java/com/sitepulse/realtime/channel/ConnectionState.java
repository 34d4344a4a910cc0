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
 * Connection lifecycle states for a shared channel.
 *
 * <pre>
 *   IDLE -> CONNECTING -> SUBSCRIBED -> ERROR -> CONNECTING (retry)
 *                                            -> CLOSED (attempts exhausted)
 *   SUBSCRIBED | ERROR | CONNECTING -> CLOSED (last subscriber gone)
 * </pre>
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    SUBSCRIBED,
    ERROR,
    CLOSED
}
