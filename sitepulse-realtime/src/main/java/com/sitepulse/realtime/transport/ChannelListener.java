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

import com.fasterxml.jackson.databind.JsonNode;
import com.sitepulse.realtime.channel.EventClass;

/**
 * Events a transport reports for one opened channel. Signals from a connection
 * that has since been replaced or closed are ignored by the receiver.
 */
public interface ChannelListener {

    /** Backend acknowledged the channel. */
    void onOpen();

    /** A change arrived on the channel. */
    void onMessage(EventClass eventType, JsonNode payload);

    /** The open failed, or a live channel failed. */
    void onError(Throwable cause);

    /** The backend closed the channel. */
    void onClose();
}
