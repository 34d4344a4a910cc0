/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.transport;

/**
 * A single open (or opening) channel on the backend stream.
 */
@FunctionalInterface
public interface ChannelConnection extends AutoCloseable {

    /** Close the channel. Called at most once by the registry. */
    @Override
    void close() throws Exception;
}
