package com.delta.notifier.model;

public enum OutboundMessageKind {
    SCHEDULED,
    ON_DEMAND,
    REPLY
}
