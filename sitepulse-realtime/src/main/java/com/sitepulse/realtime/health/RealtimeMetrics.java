/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.health;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Publishes registry health to Micrometer.
 *
 * <table>
 *   <caption>Meters</caption>
 *   <tr><th>Name</th><th>Type</th></tr>
 *   <tr><td>sitepulse.realtime.channels.active</td><td>Gauge</td></tr>
 *   <tr><td>sitepulse.realtime.channels.subscribed</td><td>Gauge</td></tr>
 *   <tr><td>sitepulse.realtime.channels.errored</td><td>Gauge</td></tr>
 *   <tr><td>sitepulse.realtime.subscriptions.total</td><td>Gauge</td></tr>
 *   <tr><td>sitepulse.realtime.reconnection.attempts</td><td>FunctionCounter</td></tr>
 *   <tr><td>sitepulse.realtime.connection.errors</td><td>FunctionCounter</td></tr>
 *   <tr><td>sitepulse.realtime.callback.failures</td><td>FunctionCounter</td></tr>
 *   <tr><td>sitepulse.realtime.events.received</td><td>FunctionCounter</td></tr>
 *   <tr><td>sitepulse.realtime.events.dropped</td><td>FunctionCounter</td></tr>
 * </table>
 *
 * All meters carry a {@code registry} tag with the registry name.
 */
public class RealtimeMetrics {

    private static final Logger log = LoggerFactory.getLogger(RealtimeMetrics.class);

    private final MeterRegistry meterRegistry;
    private final HealthReporter reporter;
    private final Tags tags;

    public RealtimeMetrics(MeterRegistry meterRegistry, HealthReporter reporter, String name) {
        this.meterRegistry = meterRegistry;
        this.reporter = reporter;
        this.tags = Tags.of("registry", name);

        gauge("sitepulse.realtime.channels.active", "Channels with at least one subscriber",
                r -> r.snapshot().activeChannels());
        gauge("sitepulse.realtime.channels.subscribed", "Channels currently subscribed to the backend",
                r -> r.snapshot().subscribedChannels());
        gauge("sitepulse.realtime.channels.errored", "Channels in error or out of retries",
                r -> r.snapshot().erroredChannels());
        gauge("sitepulse.realtime.subscriptions.total", "Callbacks registered across all channels",
                r -> r.snapshot().totalSubscriptions());

        HealthCounters counters = reporter.counters();
        counter("sitepulse.realtime.reconnection.attempts", "Reconnect attempts started",
                counters, HealthCounters::getReconnectionAttempts);
        counter("sitepulse.realtime.connection.errors", "Failed opens and dropped channels",
                counters, HealthCounters::getConnectionErrors);
        counter("sitepulse.realtime.callback.failures", "Subscriber callbacks that threw",
                counters, HealthCounters::getCallbackFailures);
        counter("sitepulse.realtime.events.received", "Change events received from the backend",
                counters, HealthCounters::getEventsReceived);
        counter("sitepulse.realtime.events.dropped", "Deliveries dropped because a subscriber was behind",
                counters, HealthCounters::getEventsDropped);

        log.info("RealtimeMetrics registered for registry '{}'", name);
    }

    private void gauge(String name, String description, ToDoubleFunction<HealthReporter> fn) {
        Gauge.builder(name, reporter, fn)
                .description(description)
                .tags(tags)
                .register(meterRegistry);
    }

    private void counter(String name, String description, HealthCounters counters,
                         ToDoubleFunction<HealthCounters> fn) {
        FunctionCounter.builder(name, counters, fn)
                .description(description)
                .tags(tags)
                .register(meterRegistry);
    }
}
