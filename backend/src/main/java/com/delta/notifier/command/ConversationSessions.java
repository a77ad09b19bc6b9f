package com.delta.notifier.command;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ConversationSessions {
    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

    public Optional<ConversationState> current(String subscriberId) {
        return Optional.ofNullable(states.get(subscriberId));
    }

    public void await(String subscriberId, ConversationState state) {
        states.put(subscriberId, state);
    }

    public void clear(String subscriberId) {
        states.remove(subscriberId);
    }
}
