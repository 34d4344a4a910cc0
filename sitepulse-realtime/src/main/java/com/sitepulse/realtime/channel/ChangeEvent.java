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

import com.fasterxml.jackson.databind.JsonNode;
import com.sitepulse.common.util.JsonUtil;

import java.time.Instant;

/**
 * One change notification delivered to subscribers.
 *
 * <p>The payload is whatever the backend sent; it is forwarded untouched.
 *
 * @param channel    key of the channel the event arrived on
 * @param eventType  change class reported by the backend
 * @param payload    opaque change body
 * @param receivedAt when the channel received it
 */
public record ChangeEvent(ChannelKey channel, EventClass eventType, JsonNode payload, Instant receivedAt) {

    /** Convert the payload into a typed value using the shared mapper. */
    public <T> T payloadAs(Class<T> type) {
        return JsonUtil.convert(payload, type);
    }
}
