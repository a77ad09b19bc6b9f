package com.delta.notifier.model;

public record DeliveryCycleResult(
    String subscriberId,
    DeliveryCycleStatus status,
    int entriesFetched,
    int newEntries,
    int batchesBuilt,
    int batchesSent,
    int batchesFailed
) {
    public static DeliveryCycleResult empty(String subscriberId, DeliveryCycleStatus status, int entriesFetched) {
        return new DeliveryCycleResult(subscriberId, status, entriesFetched, 0, 0, 0, 0);
    }
}
