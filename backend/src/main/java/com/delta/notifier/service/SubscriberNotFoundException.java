package com.delta.notifier.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SubscriberNotFoundException extends RuntimeException {
    private final String subscriberId;

    public SubscriberNotFoundException(String subscriberId) {
        super("subscriber not found: " + subscriberId);
        this.subscriberId = subscriberId;
    }

    public String getSubscriberId() {
        return subscriberId;
    }
}
