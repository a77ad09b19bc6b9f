package com.delta.notifier.service;

import com.delta.notifier.config.NotifierProperties;
import com.delta.notifier.persistence.SubscriberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class SchedulerBootstrapRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SchedulerBootstrapRunner.class);

    private final SubscriberRepository repository;
    private final SubscriptionService subscriptionService;
    private final NotifierProperties properties;

    public SchedulerBootstrapRunner(
        SubscriberRepository repository,
        SubscriptionService subscriptionService,
        NotifierProperties properties
    ) {
        this.repository = repository;
        this.subscriptionService = subscriptionService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getScheduler().isRestoreOnStartup()) {
            log.info("Timer restore disabled; no subscriber timers installed at startup");
            return;
        }
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping timer restore because database is unreachable");
            return;
        }
        subscriptionService.restoreTimers();
    }
}
