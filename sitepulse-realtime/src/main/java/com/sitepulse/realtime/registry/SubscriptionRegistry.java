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

import com.sitepulse.realtime.channel.ChangeHandler;
import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.channel.ConnectionState;
import com.sitepulse.realtime.channel.StateChangeListener;
import com.sitepulse.realtime.config.RealtimeConfig;
import com.sitepulse.realtime.health.ChannelInfo;
import com.sitepulse.realtime.health.HealthCounters;
import com.sitepulse.realtime.scheduler.RealtimeScheduler;
import com.sitepulse.realtime.transport.ChangeStreamProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shares one backend channel per {@link ChannelKey} between any number of callbacks.
 *
 * <p>The first {@link #acquire} for a key opens the channel. Later ones for the same
 * key join it. When the last callback is released the channel is closed after the
 * configured grace period, unless someone subscribes again first.
 *
 * <p>Per-key create, join, release and teardown are atomic with respect to each
 * other through {@link ConcurrentHashMap#compute}; different keys never contend.
 *
 * <p>Usage:
 * <pre>{@code
 *   SubscriptionRegistry registry = new SubscriptionRegistry(config, provider, scheduler,
 *       connectPool, dispatchPool, Clock.systemUTC());
 *   Registration reg = registry.acquire(ChannelKey.of("tasks"), event -> handle(event), null)
 *       .orElseThrow();
 *   ...
 *   registry.release(reg);
 * }</pre>
 */
public class SubscriptionRegistry implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final RealtimeConfig config;
    private final ChangeStreamProvider provider;
    private final RealtimeScheduler scheduler;
    private final Executor connectExecutor;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final BackoffPolicy backoffPolicy;
    private final HealthCounters counters = new HealthCounters();
    private final Instant startedAt;

    private final ConcurrentHashMap<ChannelKey, ChannelHandle> handles = new ConcurrentHashMap<>();
    private final AtomicLong subscriberIds = new AtomicLong();
    private volatile boolean shutdown;

    public SubscriptionRegistry(RealtimeConfig config, ChangeStreamProvider provider, RealtimeScheduler scheduler,
                                Executor connectExecutor, Executor dispatchExecutor, Clock clock) {
        this(config, provider, scheduler, connectExecutor, dispatchExecutor, clock, BackoffPolicy.from(config));
    }

    public SubscriptionRegistry(RealtimeConfig config, ChangeStreamProvider provider, RealtimeScheduler scheduler,
                                Executor connectExecutor, Executor dispatchExecutor, Clock clock,
                                BackoffPolicy backoffPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.startedAt = clock.instant();
        log.info("SubscriptionRegistry '{}' initialized: {}", config.getName(), config);
    }

    // ========== Acquire / release ==========

    /**
     * Register a callback on the channel for {@code key}, opening the channel if needed.
     *
     * @param handler       receives change events for the channel
     * @param stateListener receives connection state changes, may be null
     * @return the registration, or empty if the registry has been shut down
     */
    public Optional<Registration> acquire(ChannelKey key, ChangeHandler handler, StateChangeListener stateListener) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(handler, "handler");
        if (shutdown) {
            log.warn("Registry '{}' is shut down, ignoring subscription to '{}'", config.getName(), key);
            return Optional.empty();
        }

        Subscriber subscriber = new Subscriber(subscriberIds.incrementAndGet(), key, handler, stateListener,
                config.getDispatchQueueCapacity(), dispatchExecutor, counters);
        long[] openEpoch = {0};
        boolean[] created = {false};

        ChannelHandle handle = handles.compute(key, (k, existing) -> {
            ChannelHandle h = existing;
            if (h == null) {
                h = newHandle(k);
                created[0] = true;
            }
            openEpoch[0] = h.attach(subscriber);
            return h;
        });

        if (created[0]) {
            int open = handles.size();
            log.info("Channel '{}' created (open channels: {})", key, open);
            if (open > config.getMaxChannels()) {
                log.warn("Registry '{}' holds {} channels, above the configured maximum of {}",
                        config.getName(), open, config.getMaxChannels());
            }
        } else {
            log.debug("Subscriber {} joined channel '{}' ({} subscribers)",
                    subscriber.id(), key, handle.subscriberCount());
        }
        if (openEpoch[0] > 0) {
            handle.submitOpen(openEpoch[0]);
        }
        handle.drainAll();

        if (shutdown) {
            // Lost a race with shutdown(); make sure nothing stays open
            disposeNow(key);
            return Optional.empty();
        }
        return Optional.of(new Registration(key, subscriber.id()));
    }

    /**
     * Remove a callback. When it was the last one on its channel, the channel is
     * torn down after the grace period. Releasing twice is a no-op.
     *
     * @return true if this call removed the callback
     */
    public boolean release(Registration registration) {
        if (registration == null) return false;
        boolean[] removed = {false};
        handles.computeIfPresent(registration.key(), (k, h) -> {
            int remaining = h.detach(registration.id());
            if (remaining >= 0) {
                removed[0] = true;
                if (remaining == 0) {
                    h.scheduleTeardown(config.getTeardownGrace(), () -> teardown(k, h));
                }
            }
            return h;
        });
        if (removed[0]) {
            log.debug("Subscriber {} released from channel '{}'", registration.id(), registration.key());
        }
        return removed[0];
    }

    private void teardown(ChannelKey key, ChannelHandle expected) {
        boolean[] removed = {false};
        handles.computeIfPresent(key, (k, current) -> {
            if (current != expected || !current.tryDispose()) {
                return current;
            }
            removed[0] = true;
            return null;
        });
        if (removed[0]) {
            expected.closeDetachedConnection();
            log.info("Channel '{}' closed after grace period (open channels: {})", key, handles.size());
        }
    }

    private ChannelHandle newHandle(ChannelKey key) {
        return new ChannelHandle(key, provider, scheduler, connectExecutor, config.getConnectTimeout(),
                backoffPolicy, counters, clock);
    }

    // ========== Introspection ==========

    public List<ChannelInfo> channelInfo() {
        List<ChannelInfo> result = new ArrayList<>();
        for (ChannelHandle h : handles.values()) {
            result.add(h.info());
        }
        return Collections.unmodifiableList(result);
    }

    public Optional<ConnectionState> channelState(ChannelKey key) {
        ChannelHandle h = handles.get(key);
        return h == null ? Optional.empty() : Optional.of(h.state());
    }

    public Optional<ChannelInfo> channelInfo(ChannelKey key) {
        ChannelHandle h = handles.get(key);
        return h == null ? Optional.empty() : Optional.of(h.info());
    }

    /** Channels held by the registry, including ones waiting out their grace period. */
    public int channelCount() {
        return handles.size();
    }

    public int totalSubscriptions() {
        int total = 0;
        for (ChannelHandle h : handles.values()) {
            total += h.subscriberCount();
        }
        return total;
    }

    /**
     * Force the channel for {@code key} to reconnect with a fresh retry budget.
     *
     * @return false if there is no such channel
     */
    public boolean reconnect(ChannelKey key) {
        ChannelHandle h = handles.get(key);
        return h != null && h.reconnect();
    }

    public HealthCounters counters() { return counters; }
    public RealtimeConfig getConfig() { return config; }
    public Clock clock() { return clock; }
    public Instant startedAt() { return startedAt; }
    public boolean isShutdown() { return shutdown; }

    // ========== Lifecycle ==========

    /** Close every channel immediately and refuse new subscriptions. */
    public void shutdown() {
        if (shutdown) return;
        shutdown = true;
        int closed = 0;
        for (ChannelKey key : new ArrayList<>(handles.keySet())) {
            if (disposeNow(key)) closed++;
        }
        log.info("SubscriptionRegistry '{}' shut down, closed {} channels", config.getName(), closed);
    }

    private boolean disposeNow(ChannelKey key) {
        ChannelHandle[] removed = {null};
        handles.computeIfPresent(key, (k, h) -> {
            h.forceDispose();
            removed[0] = h;
            return null;
        });
        if (removed[0] == null) return false;
        removed[0].closeDetachedConnection();
        return true;
    }

    @Override
    public void close() {
        shutdown();
    }
}
