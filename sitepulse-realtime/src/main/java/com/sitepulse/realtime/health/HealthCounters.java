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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic registry-wide counters. They start at zero with the registry and
 * are never reset.
 */
public final class HealthCounters {

    private final AtomicLong reconnectionAttempts = new AtomicLong();
    private final AtomicLong connectionErrors = new AtomicLong();
    private final AtomicLong callbackFailures = new AtomicLong();
    private final AtomicLong eventsReceived = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();

    public void reconnectionAttempt() { reconnectionAttempts.incrementAndGet(); }
    public void connectionError() { connectionErrors.incrementAndGet(); }
    public void callbackFailure() { callbackFailures.incrementAndGet(); }
    public void eventReceived() { eventsReceived.incrementAndGet(); }
    public void eventDropped() { eventsDropped.incrementAndGet(); }

    public long getReconnectionAttempts() { return reconnectionAttempts.get(); }
    public long getConnectionErrors() { return connectionErrors.get(); }
    public long getCallbackFailures() { return callbackFailures.get(); }
    public long getEventsReceived() { return eventsReceived.get(); }
    public long getEventsDropped() { return eventsDropped.get(); }
}
