package com.delta.notifier.model;

public record OnDemandResult(
    String subscriberId,
    int requestedCount,
    int effectiveCount,
    boolean capped,
    int entriesDelivered,
    int batchesSent,
    int batchesFailed
) {
    public boolean isEmpty() {
        return entriesDelivered == 0;
    }
}
