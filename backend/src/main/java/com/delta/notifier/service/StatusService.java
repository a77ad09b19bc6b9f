package com.delta.notifier.service;

import com.delta.notifier.model.StatusResponse;
import com.delta.notifier.persistence.OutboundMessageRepository;
import com.delta.notifier.persistence.SeenEntryRepository;
import com.delta.notifier.persistence.SubscriberRepository;
import com.delta.notifier.schedule.SubscriptionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class StatusService {
    private static final Logger log = LoggerFactory.getLogger(StatusService.class);

    private final SubscriberRepository subscriberRepository;
    private final SeenEntryRepository seenEntryRepository;
    private final OutboundMessageRepository outboundMessageRepository;
    private final SubscriptionScheduler scheduler;

    public StatusService(
        SubscriberRepository subscriberRepository,
        SeenEntryRepository seenEntryRepository,
        OutboundMessageRepository outboundMessageRepository,
        SubscriptionScheduler scheduler
    ) {
        this.subscriberRepository = subscriberRepository;
        this.seenEntryRepository = seenEntryRepository;
        this.outboundMessageRepository = outboundMessageRepository;
        this.scheduler = scheduler;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = subscriberRepository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        if (dbConnected) {
            counts.put("subscribers", subscriberRepository.count());
            counts.put("seen_entries", seenEntryRepository.count());
            counts.put("outbound_messages", outboundMessageRepository.count());
        }
        return new StatusResponse(dbConnected, counts, scheduler.activeCount());
    }
}
