package com.delta.notifier.model;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

public record SubscriberView(
    String subscriberId,
    String notifyTime,
    long repeatIntervalHours,
    Instant nextFireAt,
    Instant createdAt,
    Instant updatedAt
) {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static SubscriberView of(Subscriber subscriber, Instant nextFireAt) {
        return new SubscriberView(
            subscriber.subscriberId(),
            HH_MM.format(subscriber.notifyTime()),
            subscriber.repeatIntervalHours(),
            nextFireAt,
            subscriber.createdAt(),
            subscriber.updatedAt()
        );
    }
}
