package com.delta.notifier.service;

import com.delta.notifier.model.Subscriber;
import com.delta.notifier.persistence.SeenEntryRepository;
import com.delta.notifier.schedule.ScheduledSubscription;
import com.delta.notifier.schedule.SubscriptionScheduler;
import com.delta.notifier.source.EntrySource;
import com.delta.notifier.support.TestEntries;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SubscriptionServiceTest {

    @MockBean
    private EntrySource entrySource;

    @MockBean(name = "subscriptionTaskScheduler")
    private TaskScheduler taskScheduler;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private SubscriptionScheduler scheduler;

    @Autowired
    private SeenEntryRepository seenEntryRepository;

    @Test
    void subscribeAppliesDefaultsAndIsIdempotent() {
        String id = TestEntries.uniqueId("sub");

        Subscriber created = subscriptionService.subscribe(id);
        subscriptionService.setTime(id, "18:45");
        Subscriber again = subscriptionService.subscribe(id);

        assertThat(created.notifyTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(created.repeatInterval()).isEqualTo(Duration.ofHours(24));
        assertThat(again.notifyTime()).isEqualTo(LocalTime.of(18, 45));
        assertThat(subscriptionService.listAll())
            .extracting(Subscriber::subscriberId)
            .containsOnlyOnce(id);
        assertThat(scheduler.scheduled(id)).isPresent();
    }

    @Test
    void preferenceChangesRebuildTheSingleTimer() {
        String id = TestEntries.uniqueId("pref");
        subscriptionService.subscribe(id);

        subscriptionService.setTime(id, "23:59");
        subscriptionService.setFrequency(id, 6);

        Subscriber stored = subscriptionService.get(id);
        assertThat(stored.notifyTime()).isEqualTo(LocalTime.of(23, 59));
        assertThat(stored.repeatIntervalHours()).isEqualTo(6);

        ScheduledSubscription timer = scheduler.scheduled(id).orElseThrow();
        assertThat(timer.interval()).isEqualTo(Duration.ofHours(6));
        assertThat(LocalTime.ofInstant(timer.firstFireAt(), ZoneOffset.UTC)).isEqualTo(LocalTime.of(23, 59));
        assertThat(timer.firstFireAt()).isBetween(Instant.now().minusSeconds(60), Instant.now().plus(Duration.ofDays(1)));
    }

    @Test
    void invalidTimeIsRejectedWithoutStateChange() {
        String id = TestEntries.uniqueId("time");
        subscriptionService.subscribe(id);

        for (String bad : List.of("24:00", "9:60", "noon", "9", "", "12:345", "9:")) {
            assertThatThrownBy(() -> subscriptionService.setTime(id, bad))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(e -> assertThat(((InvalidInputException) e).getReason())
                    .isEqualTo(InvalidInputException.Reason.INVALID_FORMAT));
        }
        assertThat(subscriptionService.get(id).notifyTime()).isEqualTo(LocalTime.of(9, 0));

        assertThat(subscriptionService.setTime(id, "7:05").notifyTime()).isEqualTo(LocalTime.of(7, 5));
        assertThat(subscriptionService.setTime(id, "9:5").notifyTime()).isEqualTo(LocalTime.of(9, 5));
        assertThat(subscriptionService.setTime(id, "12:3").notifyTime()).isEqualTo(LocalTime.of(12, 3));
    }

    @Test
    void invalidFrequencyIsRejectedWithoutStateChange() {
        String id = TestEntries.uniqueId("freq");
        subscriptionService.subscribe(id);

        assertThatThrownBy(() -> subscriptionService.setFrequency(id, 0))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> subscriptionService.setFrequency(id, -4))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> subscriptionService.setFrequency(id, "eight"))
            .isInstanceOf(InvalidInputException.class)
            .satisfies(e -> assertThat(((InvalidInputException) e).getReason())
                .isEqualTo(InvalidInputException.Reason.INVALID_VALUE));

        assertThat(subscriptionService.get(id).repeatIntervalHours()).isEqualTo(24);
        assertThat(subscriptionService.setFrequency(id, " 12 ").repeatIntervalHours()).isEqualTo(12);
    }

    @Test
    void preferencesForUnknownSubscriberDoNotInstallTimers() {
        String id = TestEntries.uniqueId("ghost");

        assertThatThrownBy(() -> subscriptionService.setTime(id, "10:00"))
            .isInstanceOf(SubscriberNotFoundException.class);
        assertThatThrownBy(() -> subscriptionService.setFrequency(id, 3))
            .isInstanceOf(SubscriberNotFoundException.class);

        assertThat(scheduler.scheduled(id)).isEmpty();
        assertThat(subscriptionService.isSubscribed(id)).isFalse();
    }

    @Test
    void unsubscribeRemovesEverythingAndIsIdempotent() {
        String id = TestEntries.uniqueId("bye");
        subscriptionService.subscribe(id);
        seenEntryRepository.markSeen(id, List.of("AcmeIntern"), Instant.now());

        assertThat(subscriptionService.unsubscribe(id)).isTrue();
        assertThat(subscriptionService.unsubscribe(id)).isFalse();

        assertThat(subscriptionService.isSubscribed(id)).isFalse();
        assertThat(seenEntryRepository.countForSubscriber(id)).isZero();
        assertThat(scheduler.scheduled(id)).isEmpty();
        assertThatThrownBy(() -> subscriptionService.get(id)).isInstanceOf(SubscriberNotFoundException.class);
    }
}
