/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.sitepulse.realtime;

import com.sitepulse.realtime.channel.ChannelKey;
import com.sitepulse.realtime.registry.Registration;
import com.sitepulse.realtime.registry.SubscriptionRegistry;

import java.util.concurrent.atomic.AtomicBoolean;

final class RegistrySubscription implements Subscription {

    private final SubscriptionRegistry registry;
    private final Registration registration;
    private final AtomicBoolean active = new AtomicBoolean(true);

    RegistrySubscription(SubscriptionRegistry registry, Registration registration) {
        this.registry = registry;
        this.registration = registration;
    }

    @Override
    public ChannelKey key() { return registration.key(); }

    @Override
    public void unsubscribe() {
        if (active.compareAndSet(true, false)) {
            registry.release(registration);
        }
    }

    @Override
    public boolean isActive() { return active.get(); }

    @Override
    public String toString() {
        return "Subscription{" + registration.key() + "#" + registration.id() + (active.get() ? "" : ", released") + "}";
    }
}
