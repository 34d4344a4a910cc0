/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime;

import com.sitepulse.realtime.channel.ChangeHandler;
import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.channel.ConnectionState;
import com.sitepulse.realtime.channel.StateChangeListener;
import com.sitepulse.realtime.health.ChannelInfo;
import com.sitepulse.realtime.health.HealthReporter;
import com.sitepulse.realtime.health.HealthSnapshot;
import com.sitepulse.realtime.registry.SubscriptionRegistry;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for application code that wants live change notifications.
 *
 * <pre>{@code
 *   try (Subscription s = facade.subscribe(ChannelKey.builder("tasks").where("project_id", "P1").build(),
 *                                          event -> refresh(event.payload()))) {
 *       ...
 *   }
 * }</pre>
 *
 * Callbacks for the same channel key share one backend channel.
 */
public class SubscriberFacade implements Closeable {

    private final SubscriptionRegistry registry;
    private final HealthReporter healthReporter;

    public SubscriberFacade(SubscriptionRegistry registry) {
        this(registry, new HealthReporter(registry));
    }

    public SubscriberFacade(SubscriptionRegistry registry, HealthReporter healthReporter) {
        this.registry = registry;
        this.healthReporter = healthReporter;
    }

    public Subscription subscribe(ChannelKey key, ChangeHandler callback) {
        return subscribe(key, callback, null);
    }

    public Subscription subscribe(ChannelKey key, ChangeHandler callback, StateChangeListener onStateChange) {
        return registry.acquire(key, callback, onStateChange)
                .<Subscription>map(r -> new RegistrySubscription(registry, r))
                .orElseGet(() -> Subscription.inactive(key));
    }

    public Subscription subscribe(String resource, ChangeHandler callback) {
        return subscribe(resource, callback, SubscribeOptions.none());
    }

    public Subscription subscribe(String resource, ChangeHandler callback, SubscribeOptions options) {
        ChannelKey key = ChannelKey.of(resource, options.filter(), options.event());
        return subscribe(key, callback, options.onStateChange());
    }

    public HealthSnapshot getHealthStatus() {
        return healthReporter.snapshot();
    }

    public List<ChannelInfo> getChannelInfo() {
        return registry.channelInfo();
    }

    public Optional<ConnectionState> getChannelStatus(ChannelKey key) {
        return registry.channelState(key);
    }

    /**
     * Operator-initiated restart of one channel: the current connection is closed,
     * listeners see CLOSED then CONNECTING, and the retry budget starts over.
     *
     * @return false if no channel exists for the key
     */
    public boolean reconnect(ChannelKey key) {
        return registry.reconnect(key);
    }

    /** Closes every channel. Later subscriptions are inactive. */
    @Override
    public void close() {
        registry.shutdown();
    }
}
