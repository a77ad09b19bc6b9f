package com.delta.notifier.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;

public record Subscriber(
    String subscriberId,
    LocalTime notifyTime,
    Duration repeatInterval,
    Instant createdAt,
    Instant updatedAt
) {
    public long repeatIntervalHours() {
        return repeatInterval.toHours();
    }
}
