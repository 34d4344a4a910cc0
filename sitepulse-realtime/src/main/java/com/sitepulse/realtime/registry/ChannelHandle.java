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

import com.fasterxml.jackson.databind.JsonNode;
import com.sitepulse.realtime.channel.ChangeEvent;
import com.sitepulse.realtime.channel.ChannelConnectException;
import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.channel.ConnectionState;
import com.sitepulse.realtime.channel.EventClass;
import com.sitepulse.realtime.channel.FailureKind;
import com.sitepulse.realtime.health.ChannelInfo;
import com.sitepulse.realtime.health.HealthCounters;
import com.sitepulse.realtime.scheduler.RealtimeScheduler;
import com.sitepulse.realtime.scheduler.ScheduledTask;
import com.sitepulse.realtime.transport.ChangeStreamProvider;
import com.sitepulse.realtime.transport.ChannelConnection;
import com.sitepulse.realtime.transport.ChannelListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * One shared backend channel and the callbacks registered on it.
 *
 * <p>All mutable state is guarded by this handle's monitor. Nothing that can block
 * or call user code runs while the monitor is held: deliveries are queued on the
 * subscriber lanes under the lock and drained afterwards, and transport calls are
 * made outside it.
 *
 * <p>Every connection attempt gets a new epoch. Transport callbacks carry the epoch
 * they were opened with, so late callbacks from an abandoned attempt are ignored.
 */
final class ChannelHandle {

    private static final Logger log = LoggerFactory.getLogger(ChannelHandle.class);

    private final ChannelKey key;
    private final ChangeStreamProvider provider;
    private final RealtimeScheduler scheduler;
    private final Executor connectExecutor;
    private final Duration connectTimeout;
    private final HealthCounters counters;
    private final Clock clock;
    private final ReconnectSupervisor supervisor;
    private final Instant createdAt;

    private final Map<Long, Subscriber> subscribers = new LinkedHashMap<>();
    private ConnectionState state = ConnectionState.IDLE;
    private int attempt;
    private boolean exhausted;
    private String lastError;
    private Instant subscribedAt;
    private long epoch;
    private ChannelConnection connection;
    private ChannelConnection connectionToClose;
    private ScheduledTask openTimeout;
    private ScheduledTask pendingTeardown;
    private boolean disposed;
    private boolean openInFlight;
    private long queuedOpenEpoch;

    ChannelHandle(ChannelKey key, ChangeStreamProvider provider, RealtimeScheduler scheduler,
                  Executor connectExecutor, Duration connectTimeout, BackoffPolicy backoff,
                  HealthCounters counters, Clock clock) {
        this.key = key;
        this.provider = provider;
        this.scheduler = scheduler;
        this.connectExecutor = connectExecutor;
        this.connectTimeout = connectTimeout;
        this.counters = counters;
        this.clock = clock;
        this.supervisor = new ReconnectSupervisor(key, backoff, scheduler);
        this.createdAt = clock.instant();
    }

    // ========== Registration ==========

    /**
     * Add a subscriber. Cancels a pending teardown and starts connecting when the
     * channel is idle or has given up. A subscriber joining a channel that is
     * already connecting or connected is told the current state.
     *
     * @return the epoch to open, or 0 if no connection attempt is needed
     */
    synchronized long attach(Subscriber subscriber) {
        if (disposed) {
            throw new IllegalStateException("Channel '" + key + "' is already disposed");
        }
        subscribers.put(subscriber.id(), subscriber);
        cancelTeardownLocked();

        if (state == ConnectionState.IDLE) {
            log.info("Channel '{}' opening for its first subscriber", key);
            return beginConnectLocked();
        }
        if (state == ConnectionState.CLOSED && exhausted) {
            log.info("Channel '{}' had given up after {} attempts, new subscriber triggers a fresh try",
                    key, attempt);
            resetRetriesLocked();
            return beginConnectLocked();
        }
        subscriber.offerState(state, lastError);
        return 0;
    }

    /**
     * Remove a subscriber and stop its deliveries.
     *
     * @return subscribers left, or -1 if the id was not registered here
     */
    synchronized int detach(long subscriberId) {
        Subscriber removed = subscribers.remove(subscriberId);
        if (removed == null) return -1;
        removed.deactivate();
        return subscribers.size();
    }

    synchronized int subscriberCount() {
        return subscribers.size();
    }

    synchronized ConnectionState state() {
        return state;
    }

    // ========== Teardown ==========

    synchronized void scheduleTeardown(Duration grace, Runnable teardown) {
        cancelTeardownLocked();
        pendingTeardown = scheduler.schedule(teardown, grace);
        log.debug("Channel '{}' has no subscribers, teardown in {}ms", key, grace.toMillis());
    }

    /**
     * Dispose the handle if it is still unused. Must be followed by
     * {@link #closeDetachedConnection()} once the registry lock is released.
     */
    synchronized boolean tryDispose() {
        if (disposed || !subscribers.isEmpty()) return false;
        disposeLocked();
        return true;
    }

    /** Dispose regardless of subscribers. Used on shutdown. */
    synchronized void forceDispose() {
        for (Subscriber s : subscribers.values()) {
            s.deactivate();
        }
        subscribers.clear();
        if (!disposed) {
            disposeLocked();
        }
    }

    private void disposeLocked() {
        disposed = true;
        state = ConnectionState.CLOSED;
        epoch++;
        cancelOpenTimeoutLocked();
        cancelTeardownLocked();
        supervisor.cancel();
        stashConnectionLocked();
    }

    /** Close the connection detached by a state change, outside any lock. */
    void closeDetachedConnection() {
        ChannelConnection toClose;
        synchronized (this) {
            toClose = connectionToClose;
            connectionToClose = null;
        }
        if (toClose == null) return;
        try {
            toClose.close();
            log.debug("Channel '{}' connection closed", key);
        } catch (Exception e) {
            log.warn("Channel '{}' failed to close its connection cleanly: {}", key, e.getMessage());
        }
    }

    // ========== Connecting ==========

    /**
     * Hand the open call for {@code openEpoch} to the connect executor. At most one
     * open call per channel is outstanding: while one is still running, the newest
     * epoch is queued and opened by the same task once the running call returns.
     */
    void submitOpen(long openEpoch) {
        synchronized (this) {
            if (openInFlight) {
                queuedOpenEpoch = openEpoch;
                log.debug("Channel '{}' previous open call still running, attempt {} queued behind it",
                        key, openEpoch);
                return;
            }
            openInFlight = true;
        }
        try {
            connectExecutor.execute(() -> runOpens(openEpoch));
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                openInFlight = false;
                queuedOpenEpoch = 0;
            }
            failed(openEpoch, new ChannelConnectException(key, "connect executor rejected the attempt", e));
        }
    }

    private void runOpens(long firstEpoch) {
        long next = firstEpoch;
        boolean finished = false;
        try {
            while (next != 0) {
                open(next);
                synchronized (this) {
                    next = queuedOpenEpoch;
                    queuedOpenEpoch = 0;
                    if (next == 0) {
                        openInFlight = false;
                        finished = true;
                    }
                }
            }
        } finally {
            if (!finished) {
                synchronized (this) {
                    openInFlight = false;
                    queuedOpenEpoch = 0;
                }
            }
        }
    }

    private void open(long openEpoch) {
        synchronized (this) {
            if (openEpoch != epoch || state != ConnectionState.CONNECTING) return;
        }
        ChannelConnection opened;
        try {
            opened = provider.openChannel(key, new EpochListener(openEpoch));
        } catch (Exception e) {
            failed(openEpoch, e);
            return;
        }
        if (opened == null) {
            failed(openEpoch, new ChannelConnectException(key, "provider returned no connection"));
            return;
        }
        boolean keep;
        synchronized (this) {
            keep = openEpoch == epoch && !disposed
                    && (state == ConnectionState.CONNECTING || state == ConnectionState.SUBSCRIBED);
            if (keep) {
                connection = opened;
            }
        }
        if (!keep) {
            log.debug("Channel '{}' attempt {} was abandoned, closing its late connection", key, openEpoch);
            try {
                opened.close();
            } catch (Exception e) {
                log.warn("Channel '{}' failed to close an abandoned connection: {}", key, e.getMessage());
            }
        }
    }

    private long beginConnectLocked() {
        state = ConnectionState.CONNECTING;
        epoch++;
        long openEpoch = epoch;
        cancelOpenTimeoutLocked();
        openTimeout = scheduler.schedule(() -> timedOut(openEpoch), connectTimeout);
        broadcastLocked(ConnectionState.CONNECTING, null);
        return openEpoch;
    }

    private void resetRetriesLocked() {
        supervisor.cancel();
        attempt = 0;
        exhausted = false;
        lastError = null;
    }

    /**
     * Drop the current connection and start over with a fresh retry budget. A
     * channel that is not already closed passes through CLOSED first, so
     * listeners see a teardown followed by a new connection attempt.
     *
     * @return false if the handle is already disposed
     */
    boolean reconnect() {
        long openEpoch;
        synchronized (this) {
            if (disposed) return false;
            log.info("Channel '{}' manual reconnect requested (state {})", key, state);
            resetRetriesLocked();
            cancelOpenTimeoutLocked();
            stashConnectionLocked();
            if (state != ConnectionState.CLOSED) {
                state = ConnectionState.CLOSED;
                broadcastLocked(ConnectionState.CLOSED, null);
            }
            openEpoch = beginConnectLocked();
        }
        closeDetachedConnection();
        submitOpen(openEpoch);
        drainAll();
        return true;
    }

    // ========== Transport callbacks ==========

    private void opened(long openEpoch) {
        synchronized (this) {
            if (openEpoch != epoch || state != ConnectionState.CONNECTING) {
                log.debug("Channel '{}' ignoring stale open acknowledgement", key);
                return;
            }
            state = ConnectionState.SUBSCRIBED;
            attempt = 0;
            lastError = null;
            subscribedAt = clock.instant();
            cancelOpenTimeoutLocked();
            log.info("Channel '{}' subscribed ({} subscribers)", key, subscribers.size());
            broadcastLocked(ConnectionState.SUBSCRIBED, null);
        }
        drainAll();
    }

    private void received(long openEpoch, EventClass type, JsonNode payload) {
        synchronized (this) {
            if (openEpoch != epoch || state != ConnectionState.SUBSCRIBED) {
                log.debug("Channel '{}' ignoring message outside a live subscription", key);
                return;
            }
            counters.eventReceived();
            ChangeEvent event = new ChangeEvent(key, type == null ? EventClass.ANY : type, payload, clock.instant());
            for (Subscriber s : subscribers.values()) {
                if (!s.offerEvent(event)) {
                    counters.eventDropped();
                    log.warn("Backpressure engaged on channel '{}': subscriber {} is behind, dropping {} event",
                            key, s.id(), event.eventType());
                }
            }
        }
        drainAll();
    }

    private void timedOut(long openEpoch) {
        synchronized (this) {
            if (openEpoch != epoch || state != ConnectionState.CONNECTING) return;
            openTimeout = null;
        }
        failed(openEpoch, new ChannelConnectException(key,
                "no acknowledgement within " + connectTimeout.toMillis() + "ms"));
    }

    private void failed(long openEpoch, Throwable cause) {
        synchronized (this) {
            if (openEpoch != epoch) return;
            FailureKind kind;
            if (state == ConnectionState.CONNECTING) {
                kind = FailureKind.CONNECTION_OPEN_FAILURE;
            } else if (state == ConnectionState.SUBSCRIBED) {
                kind = FailureKind.UNEXPECTED_DISCONNECT;
            } else {
                return;
            }
            String message = cause == null ? "closed by backend" : describe(cause);
            enterErrorLocked(kind, message);
        }
        closeDetachedConnection();
        drainAll();
    }

    private void enterErrorLocked(FailureKind kind, String message) {
        state = ConnectionState.ERROR;
        attempt++;
        lastError = message;
        counters.connectionError();
        cancelOpenTimeoutLocked();
        stashConnectionLocked();
        log.warn("Channel '{}' {} (failure {}): {}", key, kind, attempt, message);
        broadcastLocked(ConnectionState.ERROR, message);

        long failedEpoch = epoch;
        Duration delay = supervisor.scheduleRetry(attempt, () -> retry(failedEpoch));
        if (delay == null) {
            state = ConnectionState.CLOSED;
            exhausted = true;
            lastError = FailureKind.ATTEMPTS_EXHAUSTED + " after " + attempt + " attempts: " + message;
            log.error("Channel '{}' gave up after {} failed attempts, it stays closed until a new subscriber arrives",
                    key, attempt);
            broadcastLocked(ConnectionState.CLOSED, lastError);
        }
    }

    private void retry(long failedEpoch) {
        long openEpoch;
        synchronized (this) {
            if (disposed || failedEpoch != epoch || state != ConnectionState.ERROR) return;
            supervisor.retryStarted();
            counters.reconnectionAttempt();
            log.info("Channel '{}' reconnecting (attempt {})", key, attempt);
            openEpoch = beginConnectLocked();
        }
        submitOpen(openEpoch);
        drainAll();
    }

    // ========== Helpers ==========

    private void broadcastLocked(ConnectionState newState, String error) {
        for (Subscriber s : subscribers.values()) {
            s.offerState(newState, error);
        }
    }

    /** Kick every lane that may have deliveries queued. Call without holding the lock. */
    void drainAll() {
        List<Subscriber> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(subscribers.values());
        }
        for (Subscriber s : snapshot) {
            s.schedule();
        }
    }

    private void stashConnectionLocked() {
        if (connection != null) {
            if (connectionToClose != null) {
                log.warn("Channel '{}' replacing a connection that was never closed", key);
            }
            connectionToClose = connection;
            connection = null;
        }
    }

    private void cancelOpenTimeoutLocked() {
        if (openTimeout != null) {
            openTimeout.cancel();
            openTimeout = null;
        }
    }

    private void cancelTeardownLocked() {
        if (pendingTeardown != null) {
            pendingTeardown.cancel();
            pendingTeardown = null;
        }
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    synchronized ChannelInfo info() {
        Instant now = clock.instant();
        return new ChannelInfo(key, key.channelName(), state, subscribers.size(), attempt, exhausted,
                lastError, createdAt, subscribedAt, Duration.between(createdAt, now));
    }

    /** Transport callbacks for one connection attempt. */
    private final class EpochListener implements ChannelListener {
        private final long openEpoch;

        EpochListener(long openEpoch) {
            this.openEpoch = openEpoch;
        }

        @Override
        public void onOpen() { opened(openEpoch); }

        @Override
        public void onMessage(EventClass type, JsonNode payload) { received(openEpoch, type, payload); }

        @Override
        public void onError(Throwable error) { failed(openEpoch, error); }

        @Override
        public void onClose() { failed(openEpoch, null); }
    }
}
