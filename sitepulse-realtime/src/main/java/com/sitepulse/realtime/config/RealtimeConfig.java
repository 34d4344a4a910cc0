/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.config;

import java.time.Duration;
import java.util.Properties;

/**
 * Settings for a {@link com.sitepulse.realtime.registry.SubscriptionRegistry}.
 *
 * <p>Usage with builder pattern:
 * <pre>{@code
 *   RealtimeConfig config = RealtimeConfig.builder()
 *       .backoffBase(Duration.ofSeconds(1))
 *       .backoffMax(Duration.ofSeconds(30))
 *       .maxAttempts(10)
 *       .teardownGrace(Duration.ofMillis(500))
 *       .build();
 * }</pre>
 *
 * <p>Or from startup properties:
 * <pre>{@code
 *   RealtimeConfig config = RealtimeConfig.fromProperties(properties);
 * }</pre>
 */
public final class RealtimeConfig {

    public static final String PREFIX = "sitepulse.realtime.";

    // --- Reconnect policy ---
    private Duration backoffBase = Duration.ofSeconds(1);
    private Duration backoffMax = Duration.ofSeconds(30);
    private int maxAttempts = 10;
    private double jitterRatio = 0.25;

    // --- Channel lifecycle ---
    private Duration teardownGrace = Duration.ofMillis(500);
    private Duration connectTimeout = Duration.ofSeconds(10);

    // --- Dispatch ---
    private int dispatchQueueCapacity = 1000;

    // --- General ---
    private int maxChannels = 100;
    private String name = "sitepulse-realtime";

    private RealtimeConfig() {}

    public static RealtimeConfig defaults() { return builder().build(); }

    private RealtimeConfig copy() {
        RealtimeConfig c = new RealtimeConfig();
        c.backoffBase = backoffBase;
        c.backoffMax = backoffMax;
        c.maxAttempts = maxAttempts;
        c.jitterRatio = jitterRatio;
        c.teardownGrace = teardownGrace;
        c.connectTimeout = connectTimeout;
        c.dispatchQueueCapacity = dispatchQueueCapacity;
        c.maxChannels = maxChannels;
        c.name = name;
        return c;
    }

    // ========== Builder ==========

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final RealtimeConfig config = new RealtimeConfig();

        public Builder backoffBase(Duration delay) {
            config.backoffBase = delay; return this;
        }
        public Builder backoffMax(Duration delay) {
            config.backoffMax = delay; return this;
        }
        public Builder maxAttempts(int attempts) {
            config.maxAttempts = attempts; return this;
        }
        public Builder jitterRatio(double ratio) {
            config.jitterRatio = ratio; return this;
        }
        public Builder teardownGrace(Duration grace) {
            config.teardownGrace = grace; return this;
        }
        public Builder connectTimeout(Duration timeout) {
            config.connectTimeout = timeout; return this;
        }
        public Builder dispatchQueueCapacity(int capacity) {
            config.dispatchQueueCapacity = capacity; return this;
        }
        public Builder maxChannels(int max) {
            config.maxChannels = max; return this;
        }
        public Builder name(String name) {
            config.name = name; return this;
        }

        public RealtimeConfig build() {
            requirePositive(config.backoffBase, "backoffBase");
            requirePositive(config.backoffMax, "backoffMax");
            if (config.backoffMax.compareTo(config.backoffBase) < 0) {
                throw new IllegalStateException("backoffMax must not be shorter than backoffBase");
            }
            if (config.maxAttempts < 0) {
                throw new IllegalStateException("maxAttempts must be >= 0, got " + config.maxAttempts);
            }
            if (config.jitterRatio < 0 || config.jitterRatio > 1) {
                throw new IllegalStateException("jitterRatio must be within [0, 1], got " + config.jitterRatio);
            }
            if (config.teardownGrace == null || config.teardownGrace.isNegative()) {
                throw new IllegalStateException("teardownGrace must be zero or positive");
            }
            requirePositive(config.connectTimeout, "connectTimeout");
            if (config.dispatchQueueCapacity < 1) {
                throw new IllegalStateException("dispatchQueueCapacity must be >= 1");
            }
            if (config.maxChannels < 1) {
                throw new IllegalStateException("maxChannels must be >= 1");
            }
            if (config.name == null || config.name.isBlank()) {
                throw new IllegalStateException("name must not be blank");
            }
            return config.copy();
        }

        private static void requirePositive(Duration d, String field) {
            if (d == null || d.isZero() || d.isNegative()) {
                throw new IllegalStateException(field + " must be a positive duration, got " + d);
            }
        }
    }

    // ========== Factory from startup properties ==========

    /**
     * Build configuration from a Properties object. Missing keys keep their defaults.
     * Recognized keys:
     *   sitepulse.realtime.backoff-base-ms, sitepulse.realtime.backoff-max-ms,
     *   sitepulse.realtime.max-attempts, sitepulse.realtime.jitter-ratio,
     *   sitepulse.realtime.teardown-grace-ms, sitepulse.realtime.connect-timeout-ms,
     *   sitepulse.realtime.dispatch-queue-capacity, sitepulse.realtime.max-channels,
     *   sitepulse.realtime.name
     *
     * @throws IllegalArgumentException if a value is not a number or a count does not fit an int
     */
    public static RealtimeConfig fromProperties(Properties props) {
        RealtimeConfig d = new RealtimeConfig();
        Builder b = builder();

        b.backoffBase(Duration.ofMillis(longProp(props, "backoff-base-ms", d.backoffBase.toMillis())))
         .backoffMax(Duration.ofMillis(longProp(props, "backoff-max-ms", d.backoffMax.toMillis())))
         .maxAttempts(intProp(props, "max-attempts", d.maxAttempts))
         .jitterRatio(doubleProp(props, "jitter-ratio", d.jitterRatio))
         .teardownGrace(Duration.ofMillis(longProp(props, "teardown-grace-ms", d.teardownGrace.toMillis())))
         .connectTimeout(Duration.ofMillis(longProp(props, "connect-timeout-ms", d.connectTimeout.toMillis())))
         .dispatchQueueCapacity(intProp(props, "dispatch-queue-capacity", d.dispatchQueueCapacity))
         .maxChannels(intProp(props, "max-channels", d.maxChannels))
         .name(props.getProperty(PREFIX + "name", d.name));

        return b.build();
    }

    private static long longProp(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number: " + raw, e);
        }
    }

    private static int intProp(Properties props, String key, int defaultValue) {
        long value = longProp(props, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is out of range: " + value);
        }
        return (int) value;
    }

    private static double doubleProp(Properties props, String key, double defaultValue) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number: " + raw, e);
        }
    }

    // ========== Getters ==========

    public Duration getBackoffBase() { return backoffBase; }
    public Duration getBackoffMax() { return backoffMax; }
    public int getMaxAttempts() { return maxAttempts; }
    public double getJitterRatio() { return jitterRatio; }
    public Duration getTeardownGrace() { return teardownGrace; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public int getDispatchQueueCapacity() { return dispatchQueueCapacity; }
    public int getMaxChannels() { return maxChannels; }
    public String getName() { return name; }

    @Override
    public String toString() {
        return "RealtimeConfig{name=" + name +
               ", backoff=" + backoffBase.toMillis() + ".." + backoffMax.toMillis() + "ms" +
               ", maxAttempts=" + maxAttempts +
               ", jitter=" + jitterRatio +
               ", grace=" + teardownGrace.toMillis() + "ms" +
               ", connectTimeout=" + connectTimeout.toMillis() + "ms" +
               ", queue=" + dispatchQueueCapacity +
               ", maxChannels=" + maxChannels + "}";
    }
}
