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

import com.fasterxml.jackson.databind.JsonNode;
import com.sitepulse.common.util.JsonUtil;
import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.config.RealtimeConfig;
import com.sitepulse.realtime.registry.Registration;
import com.sitepulse.realtime.registry.SubscriptionRegistry;
import com.sitepulse.realtime.support.FakeChangeStreamProvider;
import com.sitepulse.realtime.support.ManualScheduler;
import com.sitepulse.realtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HealthReporter}.
 */
class HealthReporterTest {

    private MutableClock clock;
    private ManualScheduler scheduler;
    private FakeChangeStreamProvider provider;
    private SubscriptionRegistry registry;
    private HealthReporter reporter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        scheduler = new ManualScheduler(clock);
        provider = new FakeChangeStreamProvider();
        registry = new SubscriptionRegistry(RealtimeConfig.builder().maxChannels(4).jitterRatio(0).build(),
                provider, scheduler, Runnable::run, Runnable::run, clock);
        reporter = new HealthReporter(registry);
    }

    @Test
    void emptyRegistryIsHealthy() {
        HealthSnapshot s = reporter.snapshot();

        assertThat(s.activeChannels()).isZero();
        assertThat(s.totalSubscriptions()).isZero();
        assertThat(s.reconnectionAttempts()).isZero();
        assertThat(s.connectionErrors()).isZero();
        assertThat(s.healthy()).isTrue();
        assertThat(s.channelUtilization()).isEqualTo("0/4");
        assertThat(s.lastHealthCheck()).isEqualTo(clock.instant());
    }

    @Test
    void countsChannelsAndSubscriptions() {
        registry.acquire(ChannelKey.of("tasks"), e -> {}, null);
        registry.acquire(ChannelKey.of("tasks"), e -> {}, null);
        registry.acquire(ChannelKey.of("projects"), e -> {}, null);
        provider.connection(0).ack();

        HealthSnapshot s = reporter.snapshot();

        assertThat(s.activeChannels()).isEqualTo(2);
        assertThat(s.totalSubscriptions()).isEqualTo(3);
        assertThat(s.subscribedChannels()).isEqualTo(1);
        assertThat(s.channelUtilization()).isEqualTo("2/4");
    }

    @Test
    void channelWaitingOutGracePeriodIsNotActive() {
        Registration reg = registry.acquire(ChannelKey.of("tasks"), e -> {}, null).orElseThrow();
        registry.release(reg);

        assertThat(registry.channelCount()).isEqualTo(1);
        assertThat(reporter.snapshot().activeChannels()).isZero();
    }

    @Test
    void failuresAreCountedAndMarkUnhealthy() {
        registry.acquire(ChannelKey.of("tasks"), e -> {}, null);
        provider.last().fail(new IllegalStateException("refused"));

        HealthSnapshot failing = reporter.snapshot();
        assertThat(failing.connectionErrors()).isEqualTo(1);
        assertThat(failing.erroredChannels()).isEqualTo(1);
        assertThat(failing.healthy()).isFalse();

        scheduler.advance(Duration.ofSeconds(1));
        provider.last().ack();

        HealthSnapshot recovered = reporter.snapshot();
        assertThat(recovered.reconnectionAttempts()).isEqualTo(1);
        assertThat(recovered.connectionErrors()).isEqualTo(1);
        assertThat(recovered.healthy()).isTrue();
        assertThat(recovered.uptime()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void snapshotRendersAsJson() {
        registry.acquire(ChannelKey.of("tasks"), e -> {}, null);

        JsonNode json = JsonUtil.readTree(reporter.snapshotJson());

        assertThat(json.get("activeChannels").asInt()).isEqualTo(1);
        assertThat(json.get("totalSubscriptions").asInt()).isEqualTo(1);
        assertThat(json.get("lastHealthCheck").asText()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(json.get("healthy").asBoolean()).isTrue();
    }

    @Test
    void statusIncludesPerChannelDetail() {
        registry.acquire(ChannelKey.builder("tasks").where("project_id", "P1").build(), e -> {}, null);

        Map<String, Object> status = reporter.status();

        assertThat(status).containsKeys("name", "health", "channels");
        JsonNode channels = JsonUtil.readTree(JsonUtil.toJson(status)).get("channels");
        assertThat(channels.size()).isEqualTo(1);
        assertThat(channels.get(0).get("channelName").asText()).isEqualTo("tasks:project_id=eq.P1:*");
        assertThat(channels.get(0).get("state").asText()).isEqualTo("CONNECTING");
    }
}
