package com.delta.notifier.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Runtime handle of one subscriber's recurring timer. Never persisted; rebuilt from the
 * registry at startup and on every preference change.
 */
public record ScheduledSubscription(
    String subscriberId,
    Instant firstFireAt,
    Duration interval,
    ScheduledFuture<?> future
) {
    public Instant nextFireAfter(Instant now) {
        return FireTimeCalculator.nextOccurrence(firstFireAt, interval, now);
    }

    void cancel() {
        if (future != null) {
            future.cancel(false);
        }
    }
}
