/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link RealtimeScheduler} backed by a single daemon timer thread.
 * Tasks must be short; anything that blocks is handed to another executor.
 */
public class ExecutorRealtimeScheduler implements RealtimeScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRealtimeScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorRealtimeScheduler(String name) {
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name + "-timer");
            t.setDaemon(true);
            return t;
        });
        pool.setRemoveOnCancelPolicy(true);
        this.executor = pool;
    }

    public ExecutorRealtimeScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled realtime task failed", e);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return new ScheduledTask() {
            @Override
            public boolean cancel() { return future.cancel(false); }

            @Override
            public boolean isDone() { return future.isDone(); }
        };
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }
}
