/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.scheduler;

import java.time.Duration;

/**
 * Delayed-task scheduler for reconnect backoff, open timeouts and debounced
 * channel teardown. Tasks never run on the scheduling thread.
 */
public interface RealtimeScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    /** Stop the scheduler. Pending tasks are discarded. */
    void shutdown();
}
