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
import com.sitepulse.realtime.scheduler.ExecutorRealtimeScheduler;
import com.sitepulse.realtime.scheduler.RealtimeScheduler;
import com.sitepulse.realtime.scheduler.RealtimeThreads;
import com.sitepulse.realtime.transport.ChangeStreamProvider;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Spring auto-configuration that creates a {@link SubscriptionRegistry} and a
 * {@link SubscriberFacade} when {@code sitepulse.realtime.enabled=true}.
 *
 * <p>The application supplies the backend by declaring a {@link ChangeStreamProvider}
 * bean. When a {@link MeterRegistry} bean is present, registry health is also
 * published as Micrometer meters.
 *
 * <p>Channels and thread pools are shut down via {@code @PreDestroy}.
 */
@Configuration
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnProperty(name = "sitepulse.realtime.enabled", havingValue = "true")
@EnableConfigurationProperties(RealtimeProperties.class)
public class RealtimeAutoConfig {

    private static final Logger log = LoggerFactory.getLogger(RealtimeAutoConfig.class);

    private SubscriptionRegistry registry;
    private RealtimeScheduler scheduler;
    private ExecutorService connectPool;
    private ExecutorService dispatchPool;

    @Bean
    @ConditionalOnMissingBean
    public RealtimeConfig realtimeConfig(RealtimeProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionRegistry subscriptionRegistry(RealtimeConfig config, RealtimeProperties properties,
                                                     ChangeStreamProvider provider) {
        scheduler = new ExecutorRealtimeScheduler(config.getName());
        connectPool = RealtimeThreads.connectPool(config.getName(), properties.getConnectThreads());
        dispatchPool = RealtimeThreads.dispatchPool(config.getName(), properties.getDispatchThreads());
        registry = new SubscriptionRegistry(config, provider, scheduler, connectPool, dispatchPool,
                Clock.systemUTC());
        log.info("SubscriptionRegistry bean created: {} (connect threads {}, dispatch threads {})",
                config, properties.getConnectThreads(), properties.getDispatchThreads());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthReporter realtimeHealthReporter(SubscriptionRegistry registry) {
        return new HealthReporter(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriberFacade subscriberFacade(SubscriptionRegistry registry, HealthReporter healthReporter) {
        return new SubscriberFacade(registry, healthReporter);
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public RealtimeMetrics realtimeMetrics(MeterRegistry meterRegistry, HealthReporter healthReporter,
                                           RealtimeConfig config) {
        return new RealtimeMetrics(meterRegistry, healthReporter, config.getName());
    }

    @PreDestroy
    public void destroy() {
        if (registry != null && !registry.isShutdown()) {
            registry.shutdown();
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        if (connectPool != null) {
            connectPool.shutdownNow();
        }
        if (dispatchPool != null) {
            dispatchPool.shutdownNow();
        }
    }
}
