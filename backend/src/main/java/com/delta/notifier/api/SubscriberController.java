package com.delta.notifier.api;

import com.delta.notifier.delivery.DeliveryEngine;
import com.delta.notifier.model.DeliveryCycleResult;
import com.delta.notifier.model.OnDemandResult;
import com.delta.notifier.model.OutboundMessage;
import com.delta.notifier.model.SubscriberView;
import com.delta.notifier.persistence.OutboundMessageRepository;
import com.delta.notifier.service.SubscriptionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/subscribers")
public class SubscriberController {
    private static final int MAX_MESSAGE_LIMIT = 200;

    private final SubscriptionService subscriptionService;
    private final DeliveryEngine deliveryEngine;
    private final OutboundMessageRepository outboundMessageRepository;

    public SubscriberController(
        SubscriptionService subscriptionService,
        DeliveryEngine deliveryEngine,
        OutboundMessageRepository outboundMessageRepository
    ) {
        this.subscriptionService = subscriptionService;
        this.deliveryEngine = deliveryEngine;
        this.outboundMessageRepository = outboundMessageRepository;
    }

    @GetMapping
    public List<SubscriberView> list() {
        return subscriptionService.viewAll();
    }

    @GetMapping("/{id}")
    public SubscriberView get(@PathVariable("id") String id) {
        return subscriptionService.view(id);
    }

    @PostMapping("/{id}")
    public SubscriberView subscribe(@PathVariable("id") String id) {
        subscriptionService.subscribe(id);
        return subscriptionService.view(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> unsubscribe(@PathVariable("id") String id) {
        subscriptionService.unsubscribe(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/time")
    public SubscriberView setTime(@PathVariable("id") String id, @RequestParam("value") String value) {
        subscriptionService.setTime(id, value);
        return subscriptionService.view(id);
    }

    @PutMapping("/{id}/frequency")
    public SubscriberView setFrequency(@PathVariable("id") String id, @RequestParam("hours") String hours) {
        subscriptionService.setFrequency(id, hours);
        return subscriptionService.view(id);
    }

    @PostMapping("/{id}/updates")
    public OnDemandResult updates(
        @PathVariable("id") String id,
        @RequestParam(name = "count", required = false) Integer count
    ) {
        return deliveryEngine.deliverOnDemand(id, count);
    }

    @PostMapping("/{id}/cycle")
    public DeliveryCycleResult runCycle(@PathVariable("id") String id) {
        subscriptionService.get(id);
        return deliveryEngine.runCycle(id);
    }

    @GetMapping("/{id}/messages")
    public List<OutboundMessage> messages(
        @PathVariable("id") String id,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        if (limit <= 0) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be positive");
        }
        return outboundMessageRepository.findRecent(id, Math.min(limit, MAX_MESSAGE_LIMIT));
    }
}
