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

/**
 * A pending delayed task.
 */
public interface ScheduledTask {

    /**
     * Cancel the task if it has not started.
     *
     * @return true if this call prevented the task from running
     */
    boolean cancel();

    boolean isDone();
}
