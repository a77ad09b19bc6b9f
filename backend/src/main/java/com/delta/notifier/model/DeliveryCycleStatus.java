package com.delta.notifier.model;

public enum DeliveryCycleStatus {
    DELIVERED,
    NO_NEW_ENTRIES,
    FETCH_FAILED,
    SKIPPED_IN_FLIGHT,
    SUBSCRIBER_GONE
}
