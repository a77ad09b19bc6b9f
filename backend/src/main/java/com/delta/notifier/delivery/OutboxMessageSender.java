package com.delta.notifier.delivery;

import com.delta.notifier.model.OutboundMessageKind;
import com.delta.notifier.persistence.OutboundMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Default sender: appends each message to the {@code outbound_messages} table, from which
 * a transport relay picks it up.
 */
@Service
public class OutboxMessageSender implements MessageSender {
    private static final Logger log = LoggerFactory.getLogger(OutboxMessageSender.class);

    private final OutboundMessageRepository repository;
    private final Clock clock;

    public OutboxMessageSender(OutboundMessageRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void send(String subscriberId, OutboundMessageKind kind, String body) throws SendException {
        try {
            long id = repository.insert(subscriberId, kind, body, Instant.now(clock));
            log.debug("Queued {} message {} for subscriber {} ({} chars)", kind, id, subscriberId, body.length());
        } catch (RuntimeException e) {
            throw new SendException("failed to queue message for subscriber " + subscriberId, e);
        }
    }
}
