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

import com.sitepulse.realtime.channel.ChangeEvent;
import com.sitepulse.realtime.channel.ChangeHandler;
import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.channel.ConnectionState;
import com.sitepulse.realtime.channel.FailureKind;
import com.sitepulse.realtime.channel.StateChangeListener;
import com.sitepulse.realtime.health.HealthCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One registered callback and its delivery lane.
 *
 * <p>Deliveries are queued by the owning channel while it holds its lock, so the
 * queue order is the channel's event order. The lane is drained on the dispatch
 * executor by at most one task at a time. Change events beyond the configured
 * capacity are refused. State notifications are never refused, but a run of them
 * queued back to back keeps only its first and its latest entry, so a listener
 * that stalls while the channel flaps does not grow the lane without bound.
 */
final class Subscriber {

    private static final Logger log = LoggerFactory.getLogger(Subscriber.class);

    private record Delivery(ChangeEvent event, StateSlot state) {}

    private record StateChange(ConnectionState state, String error) {}

    /** A queued state notification that can be overwritten until the lane takes it. */
    private static final class StateSlot {
        private StateChange change;
        private boolean taken;

        StateSlot(StateChange change) {
            this.change = change;
        }

        synchronized boolean replace(StateChange latest) {
            if (taken) return false;
            change = latest;
            return true;
        }

        synchronized boolean isTaken() { return taken; }

        synchronized StateChange take() {
            taken = true;
            return change;
        }
    }

    private final long id;
    private final ChannelKey key;
    private final ChangeHandler handler;
    private final StateChangeListener stateListener;
    private final int capacity;
    private final Executor executor;
    private final HealthCounters counters;

    private final Queue<Delivery> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queuedEvents = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile boolean active = true;

    // Guarded by the owning channel's lock, which serializes every offer
    private StateSlot lastState;
    private int statesInRun;

    Subscriber(long id, ChannelKey key, ChangeHandler handler, StateChangeListener stateListener,
               int capacity, Executor executor, HealthCounters counters) {
        this.id = id;
        this.key = key;
        this.handler = handler;
        this.stateListener = stateListener;
        this.capacity = capacity;
        this.executor = executor;
        this.counters = counters;
    }

    long id() { return id; }

    /** @return false if the lane is full and the event was refused */
    boolean offerEvent(ChangeEvent event) {
        if (!active) return true;
        if (queuedEvents.incrementAndGet() > capacity) {
            queuedEvents.decrementAndGet();
            return false;
        }
        pending.add(new Delivery(event, null));
        lastState = null;
        statesInRun = 0;
        return true;
    }

    void offerState(ConnectionState state, String error) {
        if (!active || stateListener == null) return;
        StateChange change = new StateChange(state, error);
        StateSlot last = lastState;
        if (last != null && statesInRun >= 2 && last.replace(change)) {
            return;
        }
        if (last == null || last.isTaken()) {
            statesInRun = 0;
        }
        StateSlot slot = new StateSlot(change);
        lastState = slot;
        statesInRun++;
        pending.add(new Delivery(null, slot));
    }

    /** Stop all further deliveries. One already running is not interrupted. */
    void deactivate() {
        active = false;
        pending.clear();
        queuedEvents.set(0);
        lastState = null;
        statesInRun = 0;
    }

    /** Start draining the lane if it has work and is not already being drained. */
    void schedule() {
        if (pending.isEmpty() || !draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Dispatch executor rejected deliveries for subscriber {} on '{}': {}",
                    id, key, e.getMessage());
        }
    }

    private void drain() {
        try {
            Delivery delivery;
            while ((delivery = pending.poll()) != null) {
                if (delivery.event() != null) {
                    queuedEvents.decrementAndGet();
                }
                if (delivery.event() != null) {
                    if (active) deliverEvent(delivery.event());
                } else {
                    StateChange change = delivery.state().take();
                    if (active) deliverState(change.state(), change.error());
                }
            }
        } finally {
            draining.set(false);
        }
        // A producer may have queued after the last poll but before the flag was cleared
        if (active && !pending.isEmpty()) {
            schedule();
        }
    }

    private void deliverEvent(ChangeEvent event) {
        try {
            handler.onChange(event);
        } catch (Exception e) {
            counters.callbackFailure();
            log.error("{}: subscriber {} on channel '{}' threw while handling a {} event: {}",
                    FailureKind.CALLBACK_FAILURE, id, key, event.eventType(), e.getMessage(), e);
        }
    }

    private void deliverState(ConnectionState state, String error) {
        try {
            stateListener.onStateChange(state, error);
        } catch (Exception e) {
            counters.callbackFailure();
            log.error("{}: state listener of subscriber {} on channel '{}' threw for {}: {}",
                    FailureKind.CALLBACK_FAILURE, id, key, state, e.getMessage(), e);
        }
    }
}
