package com.delta.notifier.delivery;

import com.delta.notifier.config.NotifierProperties;
import com.delta.notifier.model.DeliveryCycleResult;
import com.delta.notifier.model.DeliveryCycleStatus;
import com.delta.notifier.model.Entry;
import com.delta.notifier.model.OnDemandResult;
import com.delta.notifier.model.OutboundMessageKind;
import com.delta.notifier.persistence.SeenEntryRepository;
import com.delta.notifier.persistence.SubscriberRepository;
import com.delta.notifier.service.InvalidInputException;
import com.delta.notifier.service.SubscriberLocks;
import com.delta.notifier.source.EntryFetchException;
import com.delta.notifier.source.EntrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs delivery cycles: fetch the listing, keep the entries the subscriber has not been
 * sent yet, record them as seen, then hand size-bounded batches to the sender.
 *
 * <p>Entries are recorded as seen before any batch is sent, so a failed send is never
 * retried (at-most-once delivery). At most one scheduled cycle per subscriber runs at a
 * time; a cycle requested while another is in flight is skipped.
 */
@Service
public class DeliveryEngine {
    private static final Logger log = LoggerFactory.getLogger(DeliveryEngine.class);

    private final EntrySource entrySource;
    private final MessageSender sender;
    private final EntryFormatter formatter;
    private final SeenEntryRepository seenEntryRepository;
    private final SubscriberRepository subscriberRepository;
    private final SubscriberLocks subscriberLocks;
    private final NotifierProperties properties;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public DeliveryEngine(
        EntrySource entrySource,
        MessageSender sender,
        EntryFormatter formatter,
        SeenEntryRepository seenEntryRepository,
        SubscriberRepository subscriberRepository,
        SubscriberLocks subscriberLocks,
        NotifierProperties properties,
        Clock clock
    ) {
        this.entrySource = entrySource;
        this.sender = sender;
        this.formatter = formatter;
        this.seenEntryRepository = seenEntryRepository;
        this.subscriberRepository = subscriberRepository;
        this.subscriberLocks = subscriberLocks;
        this.properties = properties;
        this.clock = clock;
    }

    public DeliveryCycleResult runCycle(String subscriberId) {
        if (!inFlight.add(subscriberId)) {
            log.warn("Skipping delivery cycle for subscriber {}: previous cycle still running", subscriberId);
            return DeliveryCycleResult.empty(subscriberId, DeliveryCycleStatus.SKIPPED_IN_FLIGHT, 0);
        }
        try {
            return doRunCycle(subscriberId);
        } finally {
            inFlight.remove(subscriberId);
        }
    }

    public boolean isCycleInFlight(String subscriberId) {
        return inFlight.contains(subscriberId);
    }

    /**
     * Sends the first {@code requestedCount} entries of the listing regardless of delivery
     * history. Never reads or writes the seen-set.
     */
    public OnDemandResult deliverOnDemand(String subscriberId, Integer requestedCount) {
        NotifierProperties.OnDemand limits = properties.getOnDemand();
        int requested = requestedCount == null ? limits.getDefaultCount() : requestedCount;
        if (requested <= 0) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_VALUE, "count must be a positive number");
        }
        boolean capped = requested > limits.getMaxCount();
        int effective = capped ? limits.getMaxCount() : requested;

        List<Entry> entries = fetchQuietly(subscriberId);
        if (entries == null || entries.isEmpty()) {
            return new OnDemandResult(subscriberId, requested, effective, capped, 0, 0, 0);
        }
        List<Entry> selected = entries.subList(0, Math.min(effective, entries.size()));
        List<String> blocks = new ArrayList<>(selected.size());
        for (Entry entry : selected) {
            blocks.add(formatter.format(entry, true));
        }
        List<String> batches = BatchAssembler.assemble(blocks, properties.getDelivery().getMaxMessageChars());
        int sent = sendAll(subscriberId, OutboundMessageKind.ON_DEMAND, batches);
        return new OnDemandResult(
            subscriberId,
            requested,
            effective,
            capped,
            selected.size(),
            sent,
            batches.size() - sent
        );
    }

    private DeliveryCycleResult doRunCycle(String subscriberId) {
        List<Entry> entries = fetchQuietly(subscriberId);
        if (entries == null) {
            return DeliveryCycleResult.empty(subscriberId, DeliveryCycleStatus.FETCH_FAILED, 0);
        }

        List<Entry> fresh = subscriberLocks.call(subscriberId, () -> recordNewEntries(subscriberId, entries));
        if (fresh == null) {
            log.info("Subscriber {} was removed before delivery; dropping cycle", subscriberId);
            return DeliveryCycleResult.empty(subscriberId, DeliveryCycleStatus.SUBSCRIBER_GONE, entries.size());
        }
        if (fresh.isEmpty()) {
            log.debug("No new entries for subscriber {} ({} fetched)", subscriberId, entries.size());
            return DeliveryCycleResult.empty(subscriberId, DeliveryCycleStatus.NO_NEW_ENTRIES, entries.size());
        }

        List<String> blocks = new ArrayList<>(fresh.size());
        for (Entry entry : fresh) {
            blocks.add(formatter.format(entry, false));
        }
        List<String> batches = BatchAssembler.assemble(blocks, properties.getDelivery().getMaxMessageChars());
        int sent = sendAll(subscriberId, OutboundMessageKind.SCHEDULED, batches);
        log.info(
            "Delivery cycle for subscriber {} complete. fetched={}, new={}, batches={}, failed={}",
            subscriberId,
            entries.size(),
            fresh.size(),
            batches.size(),
            batches.size() - sent
        );
        return new DeliveryCycleResult(
            subscriberId,
            DeliveryCycleStatus.DELIVERED,
            entries.size(),
            fresh.size(),
            batches.size(),
            sent,
            batches.size() - sent
        );
    }

    // Runs under the subscriber lock. Returns null when the subscriber no longer exists.
    private List<Entry> recordNewEntries(String subscriberId, List<Entry> entries) {
        if (!subscriberRepository.exists(subscriberId)) {
            return null;
        }
        Set<String> seen = seenEntryRepository.findIdentities(subscriberId);
        Set<String> taken = new HashSet<>();
        List<Entry> fresh = new ArrayList<>();
        List<String> identities = new ArrayList<>();
        for (Entry entry : entries) {
            String identity = entry.identity();
            if (seen.contains(identity) || !taken.add(identity)) {
                continue;
            }
            fresh.add(entry);
            identities.add(identity);
        }
        if (!identities.isEmpty()) {
            seenEntryRepository.markSeen(subscriberId, identities, Instant.now(clock));
        }
        return fresh;
    }

    private List<Entry> fetchQuietly(String subscriberId) {
        try {
            return entrySource.fetchEntries();
        } catch (EntryFetchException e) {
            log.warn("Listing fetch failed for subscriber {} ({}): {}", subscriberId, e.getKind(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Listing fetch failed for subscriber {}", subscriberId, e);
            return null;
        }
    }

    private int sendAll(String subscriberId, OutboundMessageKind kind, List<String> batches) {
        int sent = 0;
        for (int i = 0; i < batches.size(); i++) {
            try {
                sender.send(subscriberId, kind, batches.get(i));
                sent++;
            } catch (SendException | RuntimeException e) {
                log.error("Failed to send batch {}/{} to subscriber {}", i + 1, batches.size(), subscriberId, e);
            }
        }
        return sent;
    }
}
