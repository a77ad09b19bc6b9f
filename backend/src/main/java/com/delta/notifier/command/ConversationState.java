package com.delta.notifier.command;

/**
 * Pending prompt for a subscriber. Absence of a state means the next plain-text message is
 * not expected.
 */
public enum ConversationState {
    AWAITING_TIME,
    AWAITING_FREQUENCY
}
