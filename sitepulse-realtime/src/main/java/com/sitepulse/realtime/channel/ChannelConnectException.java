/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.channel;

import com.sitepulse.common.exception.SitePulseException;

/**
 * Raised when a channel cannot be opened, either by a transport refusing it or
 * by the open timing out.
 */
public class ChannelConnectException extends SitePulseException {

    public static final String CODE = "SP_CHANNEL_CONNECT";

    public ChannelConnectException(ChannelKey key, String message) {
        super(CODE, "Cannot open channel '" + key.channelName() + "': " + message);
    }

    public ChannelConnectException(ChannelKey key, String message, Throwable cause) {
        super(CODE, "Cannot open channel '" + key.channelName() + "': " + message, cause);
    }
}
