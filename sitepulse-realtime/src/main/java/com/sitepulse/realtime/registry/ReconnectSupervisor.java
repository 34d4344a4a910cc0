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
import com.sitepulse.realtime.scheduler.RealtimeScheduler;
import com.sitepulse.realtime.scheduler.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Schedules reconnect attempts for one channel.
 *
 * <p>Holds at most one pending retry. Scheduling while a retry is still pending
 * cancels the old one first. Not thread-safe on its own: every call is made by
 * the owning {@link ChannelHandle} while it holds its lock.
 */
final class ReconnectSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ReconnectSupervisor.class);

    private final ChannelKey key;
    private final BackoffPolicy policy;
    private final RealtimeScheduler scheduler;

    private ScheduledTask pendingRetry;

    ReconnectSupervisor(ChannelKey key, BackoffPolicy policy, RealtimeScheduler scheduler) {
        this.key = key;
        this.policy = policy;
        this.scheduler = scheduler;
    }

    /**
     * Schedule a retry after the {@code attempt}-th consecutive failure.
     *
     * @param attempt failure count, starting at 1
     * @param retry   action to run when the delay elapses
     * @return the delay used, or null when the attempt cap is reached and nothing was scheduled
     */
    Duration scheduleRetry(int attempt, Runnable retry) {
        if (!policy.allowsRetry(attempt)) {
            cancel();
            return null;
        }
        if (hasPendingRetry()) {
            log.warn("Channel '{}' already has a pending retry, replacing it", key);
            cancel();
        }
        Duration delay = policy.delayFor(attempt - 1);
        pendingRetry = scheduler.schedule(retry, delay);
        log.warn("Channel '{}' reconnect attempt {}/{} scheduled in {}ms",
                key, attempt, policy.getMaxAttempts(), delay.toMillis());
        return delay;
    }

    /** Forget the retry that just fired so a later failure can schedule a new one. */
    void retryStarted() {
        pendingRetry = null;
    }

    boolean hasPendingRetry() {
        return pendingRetry != null && !pendingRetry.isDone();
    }

    void cancel() {
        if (pendingRetry != null) {
            pendingRetry.cancel();
            pendingRetry = null;
        }
    }
}
