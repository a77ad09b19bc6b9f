package com.delta.notifier.service;

import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Serializes read-modify-write sequences per subscriber id: registry updates with their
 * timer rebuild, and seen-set reads with the insert that follows them.
 *
 * <p>Ids are hashed onto a fixed set of monitors, so memory stays constant no matter how
 * many ids pass through. Two ids may share a monitor; that only costs contention.
 */
@Component
public class SubscriberLocks {
    static final int STRIPES = 64;

    private final Object[] stripes = new Object[STRIPES];

    public SubscriberLocks() {
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    public <T> T call(String subscriberId, Supplier<T> action) {
        synchronized (lockFor(subscriberId)) {
            return action.get();
        }
    }

    Object lockFor(String subscriberId) {
        return stripes[Math.floorMod(subscriberId.hashCode(), STRIPES)];
    }
}
