/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime.registry;

import com.sitepulse.common.util.JsonUtil;
import com.sitepulse.realtime.channel.ChangeEvent;
import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.channel.ConnectionState;
import com.sitepulse.realtime.channel.EventClass;
import com.sitepulse.realtime.health.HealthCounters;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Subscriber} lanes, drained by hand so queued work can pile up.
 */
class SubscriberLaneTest {

    private static final ChannelKey KEY = ChannelKey.of("tasks");

    private final List<Runnable> tasks = new ArrayList<>();
    private final List<String> seen = new ArrayList<>();
    private final Subscriber subscriber = new Subscriber(1L, KEY,
            e -> seen.add("event " + e.payload().get("n").asInt()),
            (state, error) -> seen.add(state.name()),
            10, tasks::add, new HealthCounters());

    private void drainLane() {
        subscriber.schedule();
        while (!tasks.isEmpty()) {
            tasks.remove(0).run();
        }
    }

    private static ChangeEvent event(int n) {
        return new ChangeEvent(KEY, EventClass.UPDATE, JsonUtil.readTree("{\"n\":" + n + "}"), Instant.EPOCH);
    }

    @Test
    void backToBackStateChangesKeepFirstAndLatest() {
        subscriber.offerState(ConnectionState.ERROR, "closed by backend");
        subscriber.offerState(ConnectionState.CONNECTING, null);
        subscriber.offerState(ConnectionState.SUBSCRIBED, null);
        subscriber.offerState(ConnectionState.ERROR, "refused");
        subscriber.offerState(ConnectionState.CONNECTING, null);

        drainLane();

        assertThat(seen).containsExactly("ERROR", "CONNECTING");
    }

    @Test
    void eventsKeepStateChangesAroundThemInOrder() {
        subscriber.offerState(ConnectionState.SUBSCRIBED, null);
        subscriber.offerEvent(event(1));
        subscriber.offerState(ConnectionState.ERROR, "refused");
        subscriber.offerState(ConnectionState.CONNECTING, null);
        subscriber.offerState(ConnectionState.SUBSCRIBED, null);
        subscriber.offerEvent(event(2));

        drainLane();

        assertThat(seen).containsExactly("SUBSCRIBED", "event 1", "ERROR", "SUBSCRIBED", "event 2");
    }

    @Test
    void deliveredStateIsNeverOverwritten() {
        subscriber.offerState(ConnectionState.ERROR, "refused");
        drainLane();

        subscriber.offerState(ConnectionState.CONNECTING, null);
        subscriber.offerState(ConnectionState.SUBSCRIBED, null);
        drainLane();

        assertThat(seen).containsExactly("ERROR", "CONNECTING", "SUBSCRIBED");
    }

    @Test
    void flappingChannelLeavesBoundedBacklog() {
        for (int i = 0; i < 10_000; i++) {
            subscriber.offerState(i % 2 == 0 ? ConnectionState.ERROR : ConnectionState.CONNECTING, null);
        }

        drainLane();

        assertThat(seen).containsExactly("ERROR", "CONNECTING");
    }
}
