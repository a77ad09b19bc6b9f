package com.delta.notifier.model;

import java.time.Instant;

public record OutboundMessage(
    long id,
    String subscriberId,
    OutboundMessageKind kind,
    String body,
    Instant createdAt
) {
}
