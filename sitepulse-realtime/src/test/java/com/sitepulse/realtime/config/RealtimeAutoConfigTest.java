/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.config;

import com.sitepulse.realtime.SubscriberFacade;
import com.sitepulse.realtime.health.HealthReporter;
import com.sitepulse.realtime.health.RealtimeMetrics;
import com.sitepulse.realtime.registry.SubscriptionRegistry;
import com.sitepulse.realtime.support.FakeChangeStreamProvider;
import com.sitepulse.realtime.transport.ChangeStreamProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RealtimeAutoConfig}.
 */
class RealtimeAutoConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RealtimeAutoConfig.class))
            .withBean(ChangeStreamProvider.class, FakeChangeStreamProvider::new);

    @Test
    void disabledByDefault() {
        runner.run(context -> assertThat(context).doesNotHaveBean(SubscriptionRegistry.class));
    }

    @Test
    void enabledCreatesRegistryAndFacade() {
        runner.withPropertyValues("sitepulse.realtime.enabled=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(SubscriptionRegistry.class);
                    assertThat(context).hasSingleBean(SubscriberFacade.class);
                    assertThat(context).hasSingleBean(HealthReporter.class);
                    assertThat(context).doesNotHaveBean(RealtimeMetrics.class);
                });
    }

    @Test
    void propertiesAreBound() {
        runner.withPropertyValues(
                        "sitepulse.realtime.enabled=true",
                        "sitepulse.realtime.name=dashboard",
                        "sitepulse.realtime.backoff-base=250ms",
                        "sitepulse.realtime.max-attempts=4",
                        "sitepulse.realtime.teardown-grace=2s")
                .run(context -> {
                    RealtimeConfig config = context.getBean(SubscriptionRegistry.class).getConfig();
                    assertThat(config.getName()).isEqualTo("dashboard");
                    assertThat(config.getBackoffBase()).isEqualTo(Duration.ofMillis(250));
                    assertThat(config.getMaxAttempts()).isEqualTo(4);
                    assertThat(config.getTeardownGrace()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(config.getBackoffMax()).isEqualTo(Duration.ofSeconds(30));
                });
    }

    @Test
    void metricsRegisteredWhenMeterRegistryPresent() {
        runner.withPropertyValues("sitepulse.realtime.enabled=true")
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(RealtimeMetrics.class);
                    MeterRegistry meters = context.getBean(MeterRegistry.class);
                    assertThat(meters.find("sitepulse.realtime.channels.active")
                            .tag("registry", "sitepulse-realtime").gauge()).isNotNull();
                });
    }

    @Test
    void invalidSettingsFailStartup() {
        runner.withPropertyValues("sitepulse.realtime.enabled=true", "sitepulse.realtime.jitter-ratio=2")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void registryIsShutDownWithContext() {
        SubscriptionRegistry[] holder = new SubscriptionRegistry[1];
        runner.withPropertyValues("sitepulse.realtime.enabled=true")
                .run(context -> holder[0] = context.getBean(SubscriptionRegistry.class));

        assertThat(holder[0].isShutdown()).isTrue();
    }
}
