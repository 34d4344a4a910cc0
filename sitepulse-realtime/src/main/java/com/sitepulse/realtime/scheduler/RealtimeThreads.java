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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon thread pools for the connect and dispatch sides of a registry.
 * Threads are named {@code <name>-connect-N} and {@code <name>-dispatch-N}.
 *
 * <p>The connect pool keeps {@code threads} warm and grows on demand, so an open
 * call that hangs on one channel never leaves another channel's open waiting in a
 * queue. Extra threads are reaped after a minute idle.
 */
public final class RealtimeThreads {

    private RealtimeThreads() {}

    public static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static ExecutorService connectPool(String name, int threads) {
        return new ThreadPoolExecutor(threads, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), daemonFactory(name + "-connect"));
    }

    public static ExecutorService dispatchPool(String name, int threads) {
        return Executors.newFixedThreadPool(threads, daemonFactory(name + "-dispatch"));
    }
}
