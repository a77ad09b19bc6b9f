package com.delta.notifier.schedule;

import com.delta.notifier.delivery.DeliveryEngine;
import com.delta.notifier.model.DeliveryCycleResult;
import com.delta.notifier.model.Subscriber;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps at most one recurring timer per subscriber. Timer threads only hand the delivery
 * cycle to the delivery worker pool; they never run a cycle themselves.
 */
@Component
public class SubscriptionScheduler {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionScheduler.class);

    private final TaskScheduler taskScheduler;
    private final ExecutorService deliveryExecutor;
    private final DeliveryEngine deliveryEngine;
    private final Clock clock;
    private final Map<String, ScheduledSubscription> active = new ConcurrentHashMap<>();

    public SubscriptionScheduler(
        @Qualifier("subscriptionTaskScheduler") TaskScheduler taskScheduler,
        @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
        DeliveryEngine deliveryEngine,
        Clock clock
    ) {
        this.taskScheduler = taskScheduler;
        this.deliveryExecutor = deliveryExecutor;
        this.deliveryEngine = deliveryEngine;
        this.clock = clock;
    }

    /**
     * Replaces any existing timer for the subscriber with one that first fires at the next
     * occurrence of its notify time and then every repeat interval.
     */
    public ScheduledSubscription schedule(Subscriber subscriber) {
        String subscriberId = subscriber.subscriberId();
        return active.compute(subscriberId, (id, existing) -> {
            if (existing != null) {
                existing.cancel();
            }
            Instant first = FireTimeCalculator.nextFireTime(subscriber.notifyTime(), Instant.now(clock));
            ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                () -> fire(id),
                first,
                subscriber.repeatInterval()
            );
            log.info(
                "Scheduled subscriber {} first at {} then every {}h",
                id,
                first,
                subscriber.repeatIntervalHours()
            );
            return new ScheduledSubscription(id, first, subscriber.repeatInterval(), future);
        });
    }

    public boolean cancel(String subscriberId) {
        ScheduledSubscription removed = active.remove(subscriberId);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.info("Cancelled timer for subscriber {}", subscriberId);
        return true;
    }

    public Optional<ScheduledSubscription> scheduled(String subscriberId) {
        return Optional.ofNullable(active.get(subscriberId));
    }

    public int activeCount() {
        return active.size();
    }

    @PreDestroy
    public void shutdown() {
        for (String subscriberId : new ArrayList<>(active.keySet())) {
            ScheduledSubscription removed = active.remove(subscriberId);
            if (removed != null) {
                removed.cancel();
            }
        }
    }

    void fire(String subscriberId) {
        if (deliveryEngine.isCycleInFlight(subscriberId)) {
            log.warn("Skipping fire for subscriber {}: previous cycle still running", subscriberId);
            return;
        }
        try {
            deliveryExecutor.submit(() -> runCycleSafely(subscriberId));
        } catch (RejectedExecutionException e) {
            log.warn("Delivery pool rejected cycle for subscriber {}", subscriberId);
        }
    }

    private void runCycleSafely(String subscriberId) {
        try {
            DeliveryCycleResult result = deliveryEngine.runCycle(subscriberId);
            log.debug("Cycle for subscriber {} ended with {}", subscriberId, result.status());
        } catch (RuntimeException e) {
            log.error("Delivery cycle for subscriber {} failed", subscriberId, e);
        }
    }
}
