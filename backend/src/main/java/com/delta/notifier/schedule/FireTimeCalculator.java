package com.delta.notifier.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Fire-time arithmetic for subscription timers. All times are UTC.
 */
public final class FireTimeCalculator {

    private FireTimeCalculator() {
    }

    /**
     * Today at {@code notifyTime} with seconds zeroed, or tomorrow when that instant is
     * already behind {@code now}.
     */
    public static Instant nextFireTime(LocalTime notifyTime, Instant now) {
        ZonedDateTime today = now.atZone(ZoneOffset.UTC)
            .withHour(notifyTime.getHour())
            .withMinute(notifyTime.getMinute())
            .truncatedTo(ChronoUnit.MINUTES);
        Instant candidate = today.toInstant();
        if (candidate.isBefore(now)) {
            candidate = today.plusDays(1).toInstant();
        }
        return candidate;
    }

    /**
     * First instant of the series {@code first + k * interval} (k >= 0) that is not before
     * {@code now}.
     */
    public static Instant nextOccurrence(Instant first, Duration interval, Instant now) {
        if (!first.isBefore(now)) {
            return first;
        }
        long intervalMillis = interval.toMillis();
        if (intervalMillis <= 0) {
            return first;
        }
        long elapsed = Duration.between(first, now).toMillis();
        long steps = (elapsed + intervalMillis - 1) / intervalMillis;
        return first.plusMillis(steps * intervalMillis);
    }
}
