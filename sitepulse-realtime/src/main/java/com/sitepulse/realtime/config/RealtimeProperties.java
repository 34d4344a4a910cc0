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

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds {@code sitepulse.realtime.*} application properties.
 *
 * <pre>
 *   sitepulse.realtime.enabled=true
 *   sitepulse.realtime.name=dashboard
 *   sitepulse.realtime.backoff-base=1s
 *   sitepulse.realtime.backoff-max=30s
 *   sitepulse.realtime.max-attempts=10
 *   sitepulse.realtime.jitter-ratio=0.25
 *   sitepulse.realtime.teardown-grace=500ms
 *   sitepulse.realtime.connect-timeout=10s
 *   sitepulse.realtime.dispatch-queue-capacity=1000
 *   sitepulse.realtime.max-channels=100
 *   sitepulse.realtime.connect-threads=2
 *   sitepulse.realtime.dispatch-threads=4
 * </pre>
 */
@ConfigurationProperties(prefix = "sitepulse.realtime")
public class RealtimeProperties {

    private boolean enabled = false;
    private String name = "sitepulse-realtime";
    private Duration backoffBase = Duration.ofSeconds(1);
    private Duration backoffMax = Duration.ofSeconds(30);
    private int maxAttempts = 10;
    private double jitterRatio = 0.25;
    private Duration teardownGrace = Duration.ofMillis(500);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private int dispatchQueueCapacity = 1000;
    private int maxChannels = 100;
    /** Connect threads kept warm; the pool grows past this while opens are hanging. */
    private int connectThreads = 2;
    private int dispatchThreads = 4;

    public RealtimeConfig toConfig() {
        return RealtimeConfig.builder()
                .name(name)
                .backoffBase(backoffBase)
                .backoffMax(backoffMax)
                .maxAttempts(maxAttempts)
                .jitterRatio(jitterRatio)
                .teardownGrace(teardownGrace)
                .connectTimeout(connectTimeout)
                .dispatchQueueCapacity(dispatchQueueCapacity)
                .maxChannels(maxChannels)
                .build();
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Duration getBackoffBase() { return backoffBase; }
    public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
    public Duration getBackoffMax() { return backoffMax; }
    public void setBackoffMax(Duration backoffMax) { this.backoffMax = backoffMax; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public double getJitterRatio() { return jitterRatio; }
    public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    public Duration getTeardownGrace() { return teardownGrace; }
    public void setTeardownGrace(Duration teardownGrace) { this.teardownGrace = teardownGrace; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public int getDispatchQueueCapacity() { return dispatchQueueCapacity; }
    public void setDispatchQueueCapacity(int dispatchQueueCapacity) { this.dispatchQueueCapacity = dispatchQueueCapacity; }
    public int getMaxChannels() { return maxChannels; }
    public void setMaxChannels(int maxChannels) { this.maxChannels = maxChannels; }
    public int getConnectThreads() { return connectThreads; }
    public void setConnectThreads(int connectThreads) { this.connectThreads = connectThreads; }
    public int getDispatchThreads() { return dispatchThreads; }
    public void setDispatchThreads(int dispatchThreads) { this.dispatchThreads = dispatchThreads; }
}
