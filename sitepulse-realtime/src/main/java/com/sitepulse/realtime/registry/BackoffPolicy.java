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

import com.sitepulse.realtime.config.RealtimeConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with a cap and additive jitter.
 *
 * <p>For retry index {@code n} (0 for the first retry) the capped delay is
 * {@code min(base * 2^n, max)}; the returned delay adds a uniformly random
 * jitter in {@code [0, capped * jitterRatio]}.
 */
public final class BackoffPolicy {

    /** 2^30 times any sane base already exceeds every sane cap. */
    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration max;
    private final int maxAttempts;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, int maxAttempts, double jitterRatio, DoubleSupplier random) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        this.maxAttempts = maxAttempts;
        this.jitterRatio = jitterRatio;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static BackoffPolicy from(RealtimeConfig config) {
        return new BackoffPolicy(config.getBackoffBase(), config.getBackoffMax(), config.getMaxAttempts(),
                config.getJitterRatio(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /** Delay before retry {@code retryIndex}, without jitter. */
    public Duration cappedDelay(int retryIndex) {
        int shift = Math.min(Math.max(retryIndex, 0), MAX_SHIFT);
        long baseMs = base.toMillis();
        long maxMs = max.toMillis();
        long delayMs = baseMs > (maxMs >> shift) ? maxMs : Math.min(baseMs << shift, maxMs);
        return Duration.ofMillis(delayMs);
    }

    /** Delay before retry {@code retryIndex}, jitter included. */
    public Duration delayFor(int retryIndex) {
        long capped = cappedDelay(retryIndex).toMillis();
        long jitter = (long) (capped * jitterRatio * clamp(random.getAsDouble()));
        return Duration.ofMillis(capped + jitter);
    }

    /** Upper bound of {@link #delayFor} for any retry index. */
    public Duration maxDelayWithJitter() {
        return Duration.ofMillis(max.toMillis() + (long) (max.toMillis() * jitterRatio));
    }

    /** Whether the channel may retry after its {@code attempt}-th consecutive failure. */
    public boolean allowsRetry(int attempt) {
        return attempt <= maxAttempts;
    }

    public int getMaxAttempts() { return maxAttempts; }

    private static double clamp(double v) {
        return v < 0 ? 0 : Math.min(v, 1);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{base=" + base.toMillis() + "ms, max=" + max.toMillis() +
               "ms, maxAttempts=" + maxAttempts + ", jitter=" + jitterRatio + "}";
    }
}
