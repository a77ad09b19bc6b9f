package com.delta.notifier.model;

public record CommandRequest(String subscriberId, String text) {
}
