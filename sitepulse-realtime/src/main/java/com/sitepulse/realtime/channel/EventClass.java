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

import java.util.Locale;

/**
 * Class of row change a channel is interested in.
 */
public enum EventClass {
    INSERT,
    UPDATE,
    DELETE,
    ANY;

    /**
     * Parse an event class as callers write it: {@code insert}, {@code UPDATE},
     * {@code *} or nothing at all. A null or blank value means {@link #ANY}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static EventClass parse(String value) {
        if (value == null || value.isBlank() || value.trim().equals("*")) {
            return ANY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event class '" + value + "'", e);
        }
    }

    /** Wire-style name used in channel names: lower case, {@code *} for ANY. */
    public String wireName() {
        return this == ANY ? "*" : name().toLowerCase(Locale.ROOT);
    }
}
