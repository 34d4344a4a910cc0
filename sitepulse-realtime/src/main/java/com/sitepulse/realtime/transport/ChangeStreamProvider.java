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

import com.sitepulse.realtime.channel.ChannelKey;

/**
 * Backend change-notification stream.
 *
 * <p>The registry calls {@link #openChannel} once per connection attempt, off the
 * subscriber's thread. The provider must report the outcome through the given
 * listener: {@link ChannelListener#onOpen()} once the backend acknowledges the
 * channel, {@link ChannelListener#onError(Throwable)} or
 * {@link ChannelListener#onClose()} when it fails or drops. An open that never
 * reports back is failed by the registry after the configured connect timeout.
 *
 * <p>Implementations must be thread-safe; listener methods may be invoked from
 * any thread.
 */
public interface ChangeStreamProvider {

    /**
     * Start opening a channel for the given key.
     *
     * @param key      what to watch
     * @param listener receives the open acknowledgement, changes, errors and close
     * @return handle used to close the channel
     * @throws Exception if the transport refuses the channel outright
     */
    ChannelConnection openChannel(ChannelKey key, ChannelListener listener) throws Exception;
}
