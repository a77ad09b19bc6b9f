package com.delta.notifier.service;

import com.delta.notifier.config.NotifierProperties;
import com.delta.notifier.model.Subscriber;
import com.delta.notifier.model.SubscriberView;
import com.delta.notifier.persistence.SubscriberRepository;
import com.delta.notifier.schedule.ScheduledSubscription;
import com.delta.notifier.schedule.SubscriptionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Subscriber registry operations. Every change to a subscriber's row and the rebuild of its
 * timer happen under that subscriber's lock.
 */
@Service
public class SubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);
    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]?\\d)$");

    private final SubscriberRepository subscriberRepository;
    private final SubscriptionScheduler scheduler;
    private final SubscriberLocks subscriberLocks;
    private final NotifierProperties properties;
    private final Clock clock;

    public SubscriptionService(
        SubscriberRepository subscriberRepository,
        SubscriptionScheduler scheduler,
        SubscriberLocks subscriberLocks,
        NotifierProperties properties,
        Clock clock
    ) {
        this.subscriberRepository = subscriberRepository;
        this.scheduler = scheduler;
        this.subscriberLocks = subscriberLocks;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Registers the subscriber with default preferences unless already registered. Existing
     * preferences are kept. The timer is (re)installed either way.
     */
    public Subscriber subscribe(String subscriberId) {
        String id = requireId(subscriberId);
        return subscriberLocks.call(id, () -> {
            LocalTime defaultTime = parseTime(properties.getDefaults().getNotifyTime());
            boolean created = subscriberRepository.insertIfAbsent(
                id,
                defaultTime,
                properties.getDefaults().getRepeatIntervalHours(),
                Instant.now(clock)
            );
            Subscriber subscriber = load(id);
            scheduler.schedule(subscriber);
            if (created) {
                log.info("Subscribed {}", id);
            }
            return subscriber;
        });
    }

    public boolean unsubscribe(String subscriberId) {
        String id = requireId(subscriberId);
        return subscriberLocks.call(id, () -> {
            scheduler.cancel(id);
            int deleted = subscriberRepository.deleteWithSeenEntries(id);
            if (deleted > 0) {
                log.info("Unsubscribed {}", id);
            }
            return deleted > 0;
        });
    }

    public Subscriber setTime(String subscriberId, String value) {
        String id = requireId(subscriberId);
        LocalTime notifyTime = parseTime(value);
        return subscriberLocks.call(id, () -> {
            if (subscriberRepository.updateNotifyTime(id, notifyTime, Instant.now(clock)) == 0) {
                throw new SubscriberNotFoundException(id);
            }
            Subscriber subscriber = load(id);
            scheduler.schedule(subscriber);
            return subscriber;
        });
    }

    public Subscriber setFrequency(String subscriberId, int hours) {
        String id = requireId(subscriberId);
        if (hours <= 0) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_VALUE, "frequency must be a positive number of hours");
        }
        return subscriberLocks.call(id, () -> {
            if (subscriberRepository.updateRepeatInterval(id, hours, Instant.now(clock)) == 0) {
                throw new SubscriberNotFoundException(id);
            }
            Subscriber subscriber = load(id);
            scheduler.schedule(subscriber);
            return subscriber;
        });
    }

    /**
     * Text form of {@link #setFrequency(String, int)}; anything that is not a whole number
     * is rejected as an invalid value.
     */
    public Subscriber setFrequency(String subscriberId, String value) {
        return setFrequency(subscriberId, parseHours(value));
    }

    /**
     * Installs a timer for every stored subscriber. Each row is re-read under its lock so a
     * subscriber removed or updated after the listing was taken is skipped or scheduled with
     * its current preferences.
     */
    public int restoreTimers() {
        List<Subscriber> snapshot = subscriberRepository.findAll();
        int restored = 0;
        for (Subscriber listed : snapshot) {
            String id = listed.subscriberId();
            try {
                boolean scheduled = subscriberLocks.call(id, () -> subscriberRepository.findById(id)
                    .map(current -> {
                        scheduler.schedule(current);
                        return true;
                    })
                    .orElse(false));
                if (scheduled) {
                    restored++;
                } else {
                    log.info("Subscriber {} was removed before its timer was restored", id);
                }
            } catch (RuntimeException e) {
                log.error("Failed to restore timer for subscriber {}", id, e);
            }
        }
        log.info("Restored {} of {} subscriber timers", restored, snapshot.size());
        return restored;
    }

    public Subscriber get(String subscriberId) {
        return load(requireId(subscriberId));
    }

    public boolean isSubscribed(String subscriberId) {
        return subscriberId != null && subscriberRepository.exists(subscriberId.trim());
    }

    public List<Subscriber> listAll() {
        return subscriberRepository.findAll();
    }

    public SubscriberView view(String subscriberId) {
        return toView(get(subscriberId));
    }

    public List<SubscriberView> viewAll() {
        List<SubscriberView> views = new ArrayList<>();
        for (Subscriber subscriber : listAll()) {
            views.add(toView(subscriber));
        }
        return views;
    }

    static LocalTime parseTime(String value) {
        Matcher matcher = value == null ? null : TIME_PATTERN.matcher(value.trim());
        if (matcher == null || !matcher.matches()) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_FORMAT, "time must be in HH:MM format (e.g. 21:00)");
        }
        return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    static int parseHours(String value) {
        if (value == null) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_VALUE, "frequency must be a positive whole number of hours");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_VALUE, "frequency must be a positive whole number of hours");
        }
    }

    private SubscriberView toView(Subscriber subscriber) {
        Instant nextFireAt = scheduler.scheduled(subscriber.subscriberId())
            .map(scheduled -> scheduled.nextFireAfter(Instant.now(clock)))
            .orElse(null);
        return SubscriberView.of(subscriber, nextFireAt);
    }

    private Subscriber load(String subscriberId) {
        return subscriberRepository.findById(subscriberId)
            .orElseThrow(() -> new SubscriberNotFoundException(subscriberId));
    }

    private String requireId(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new InvalidInputException(InvalidInputException.Reason.INVALID_VALUE, "subscriber id is required");
        }
        return subscriberId.trim();
    }
}
