package com.delta.notifier.delivery;

import com.delta.notifier.model.OutboundMessageKind;

public interface MessageSender {
    void send(String subscriberId, OutboundMessageKind kind, String body) throws SendException;
}
