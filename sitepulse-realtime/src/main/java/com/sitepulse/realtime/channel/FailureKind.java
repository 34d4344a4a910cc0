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
 * Failures a channel can run into. None of them is ever thrown to a subscriber;
 * they are logged, counted and reported through {@link StateChangeListener}.
 */
public enum FailureKind {
    /** Transport refused the channel or did not acknowledge it in time. */
    CONNECTION_OPEN_FAILURE,
    /** A live channel was dropped. */
    UNEXPECTED_DISCONNECT,
    /** A subscriber callback threw. Affects that invocation only. */
    CALLBACK_FAILURE,
    /** Retry budget spent; the channel stays closed until someone subscribes again. */
    ATTEMPTS_EXHAUSTED
}
