package com.crisisalert.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.AlertType;
import com.crisisalert.domain.enums.ChannelOutcomeType;
import com.crisisalert.domain.enums.DeferralKind;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.ChannelOutcome;
import com.crisisalert.event.AlertEventPublisher;
import com.crisisalert.exception.InvalidAlertException;
import com.crisisalert.notification.AlertLifecycleTracker;
import com.crisisalert.notification.DispatchResult;
import com.crisisalert.repository.memory.InMemoryAlertRepository;
import com.crisisalert.unit.support.ManualDeferredTaskScheduler;
import com.crisisalert.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AlertLifecycleTracker.
 *
 * <p>Verifies: status transitions, armed timer cancellation,
 * snooze redelivery, and dispatch outcomes that lose to user actions.
 */
class AlertLifecycleTrackerTest {

    private static final Instant START = Instant.parse("2026-03-10T12:00:00Z");

    private MutableClock clock;
    private ManualDeferredTaskScheduler deferredTaskScheduler;
    private AlertEventPublisher alertEventPublisher;
    private AlertLifecycleTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START, ZoneOffset.UTC);
        deferredTaskScheduler = new ManualDeferredTaskScheduler(clock);
        alertEventPublisher = mock(AlertEventPublisher.class);
        tracker = new AlertLifecycleTracker(
                new InMemoryAlertRepository(), deferredTaskScheduler, alertEventPublisher, clock);
    }

    private Alert newAlert(String userId, Instant timestamp) {
        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .type(AlertType.REMINDER)
                .priority(AlertPriority.MEDIUM)
                .title("Reminder")
                .message("Drink water")
                .timestamp(timestamp)
                .build();
    }

    private Alert registered() {
        return tracker.register(newAlert("user-1", START));
    }

    @Test
    void register_duplicateId_rejected() {
        Alert alert = registered();

        assertThatThrownBy(() -> tracker.register(alert)).isInstanceOf(InvalidAlertException.class);
    }

    @Test
    void register_keepsOwnCopy() {
        Alert alert = newAlert("user-1", START);
        tracker.register(alert);

        alert.setStatus(AlertStatus.READ);

        assertThat(tracker.find(alert.getId())).get().extracting(Alert::getStatus).isEqualTo(AlertStatus.PENDING);
    }

    @Test
    void snooze_dismissesNowAndResubmitsOnceAfterDuration() {
        Alert alert = registered();
        List<Alert> resubmitted = new ArrayList<>();

        tracker.snooze(alert.getId(), Duration.ofHours(1), resubmitted::add);

        assertThat(tracker.find(alert.getId()).get().getStatus()).isEqualTo(AlertStatus.DISMISSED);

        deferredTaskScheduler.advance(Duration.ofMinutes(59));
        assertThat(resubmitted).isEmpty();

        deferredTaskScheduler.advance(Duration.ofMinutes(1));
        assertThat(resubmitted).hasSize(1);
        assertThat(resubmitted.get(0).getId()).isEqualTo(alert.getId());
        assertThat(resubmitted.get(0).getStatus()).isEqualTo(AlertStatus.PENDING);
        assertThat(tracker.find(alert.getId()).get().getStatus()).isEqualTo(AlertStatus.PENDING);

        deferredTaskScheduler.advance(Duration.ofHours(3));
        assertThat(resubmitted).hasSize(1);
    }

    @Test
    void snooze_clearsPreviousChannelOutcomes() {
        Alert alert = registered();
        tracker.recordDispatchOutcome(alert.getId(), new DispatchResult(Map.of(
                NotificationChannel.PUSH,
                ChannelOutcome.failure(NotificationChannel.PUSH, ChannelOutcomeType.FAILED, "down", START))));
        List<Alert> resubmitted = new ArrayList<>();

        tracker.snooze(alert.getId(), Duration.ofMinutes(30), resubmitted::add);
        deferredTaskScheduler.advance(Duration.ofMinutes(30));

        assertThat(resubmitted.get(0).getChannelOutcomes()).isEmpty();
    }

    @Test
    void dismiss_cancelsQuietHoursDeferral() {
        Alert alert = registered();
        List<Alert> delivered = new ArrayList<>();
        tracker.armDeferred(alert.getId(), START.plus(Duration.ofHours(8)), DeferralKind.QUIET_HOURS, delivered::add);

        tracker.dismiss(alert.getId());
        deferredTaskScheduler.advance(Duration.ofHours(10));

        assertThat(delivered).isEmpty();
        assertThat(tracker.hasArmedTask(alert.getId())).isFalse();
        assertThat(deferredTaskScheduler.pendingCount()).isZero();
        assertThat(tracker.find(alert.getId()).get().getStatus()).isEqualTo(AlertStatus.DISMISSED);
    }

    @Test
    void dismiss_cancelsPendingSnooze() {
        Alert alert = registered();
        List<Alert> resubmitted = new ArrayList<>();
        tracker.snooze(alert.getId(), Duration.ofHours(1), resubmitted::add);

        tracker.dismiss(alert.getId());
        deferredTaskScheduler.advance(Duration.ofHours(2));

        assertThat(resubmitted).isEmpty();
        assertThat(tracker.find(alert.getId()).get().getStatus()).isEqualTo(AlertStatus.DISMISSED);
    }

    @Test
    void armDeferred_rearmingReplacesEarlierTimer() {
        Alert alert = registered();
        List<String> fired = new ArrayList<>();

        tracker.armDeferred(alert.getId(), START.plus(Duration.ofHours(1)), DeferralKind.QUIET_HOURS, a -> fired.add("first"));
        tracker.armDeferred(alert.getId(), START.plus(Duration.ofHours(2)), DeferralKind.QUIET_HOURS, a -> fired.add("second"));
        deferredTaskScheduler.advance(Duration.ofHours(3));

        assertThat(fired).containsExactly("second");
    }

    @Test
    void armDeferred_untrackedAlert_returnsFalse() {
        boolean armed = tracker.armDeferred("missing", START, DeferralKind.QUIET_HOURS, a -> {});

        assertThat(armed).isFalse();
        assertThat(deferredTaskScheduler.pendingCount()).isZero();
    }

    @Test
    void getDeferredUntil_reportsArmedTime() {
        Alert alert = registered();
        Instant at = START.plus(Duration.ofHours(8));

        tracker.armDeferred(alert.getId(), at, DeferralKind.QUIET_HOURS, a -> {});

        assertThat(tracker.getDeferredUntil(alert.getId())).contains(at);
    }

    @Test
    void acknowledge_isIdempotentFromAnyState() {
        Alert alert = registered();
        tracker.dismiss(alert.getId());

        tracker.acknowledge(alert.getId());
        tracker.acknowledge(alert.getId());

        assertThat(tracker.find(alert.getId()).get().getStatus()).isEqualTo(AlertStatus.READ);
    }

    @Test
    void unknownId_returnsEmpty() {
        assertThat(tracker.acknowledge("missing")).isEmpty();
        assertThat(tracker.dismiss("missing")).isEmpty();
        assertThat(tracker.snooze("missing", Duration.ofMinutes(5), a -> {})).isEmpty();
    }

    @Test
    void recordDispatchOutcome_pendingBecomesSentOrFailed() {
        Alert ok = registered();
        Alert broken = registered();

        tracker.recordDispatchOutcome(ok.getId(), new DispatchResult(Map.of(
                NotificationChannel.PUSH, ChannelOutcome.success(NotificationChannel.PUSH, START))));
        tracker.recordDispatchOutcome(broken.getId(), new DispatchResult(Map.of(
                NotificationChannel.PUSH, ChannelOutcome.success(NotificationChannel.PUSH, START),
                NotificationChannel.SMS,
                ChannelOutcome.failure(NotificationChannel.SMS, ChannelOutcomeType.FAILED, "boom", START))));

        assertThat(tracker.find(ok.getId()).get().getStatus()).isEqualTo(AlertStatus.SENT);
        Alert failed = tracker.find(broken.getId()).get();
        assertThat(failed.getStatus()).isEqualTo(AlertStatus.FAILED);
        assertThat(failed.getChannelOutcomes().get(NotificationChannel.PUSH).isSuccess()).isTrue();
        assertThat(failed.getDeliveryAttempts()).isEqualTo(1);
    }

    @Test
    void recordDispatchOutcome_userDismissalWins() {
        Alert alert = registered();
        tracker.dismiss(alert.getId());

        tracker.recordDispatchOutcome(alert.getId(), new DispatchResult(Map.of(
                NotificationChannel.PUSH, ChannelOutcome.success(NotificationChannel.PUSH, START))));

        assertThat(tracker.find(alert.getId()).get().getStatus()).isEqualTo(AlertStatus.DISMISSED);
    }

    @Test
    void markDelivered_onlyFromSent() {
        Alert pending = registered();
        Alert sent = registered();
        tracker.recordDispatchOutcome(sent.getId(), new DispatchResult(Map.of(
                NotificationChannel.IN_APP, ChannelOutcome.success(NotificationChannel.IN_APP, START))));

        tracker.markDelivered(pending.getId());
        tracker.markDelivered(sent.getId());

        assertThat(tracker.find(pending.getId()).get().getStatus()).isEqualTo(AlertStatus.PENDING);
        assertThat(tracker.find(sent.getId()).get().getStatus()).isEqualTo(AlertStatus.DELIVERED);
    }

    @Test
    void getActiveAlerts_filtersByUserAndStatus_newestFirst() {
        Alert oldest = tracker.register(newAlert("user-1", START.minus(Duration.ofHours(2))));
        Alert newest = tracker.register(newAlert("user-1", START));
        Alert middle = tracker.register(newAlert("user-1", START.minus(Duration.ofHours(1))));
        Alert dismissed = tracker.register(newAlert("user-1", START.plus(Duration.ofMinutes(5))));
        tracker.register(newAlert("user-2", START));
        tracker.dismiss(dismissed.getId());

        List<Alert> active = tracker.getActiveAlerts("user-1");

        assertThat(active).extracting(Alert::getId).containsExactly(newest.getId(), middle.getId(), oldest.getId());
    }

    @Test
    void removeExpired_dropsExpiredAlertsWhateverTheirStatus() {
        Alert expiredPending = tracker.register(
                newAlert("user-1", START).toBuilder().expiresAt(START.plus(Duration.ofMinutes(10))).build());
        Alert expiredRead = tracker.register(
                newAlert("user-1", START).toBuilder().expiresAt(START.plus(Duration.ofMinutes(20))).build());
        Alert live = tracker.register(
                newAlert("user-1", START).toBuilder().expiresAt(START.plus(Duration.ofDays(1))).build());
        Alert noExpiry = registered();
        tracker.acknowledge(expiredRead.getId());
        List<Alert> delivered = new ArrayList<>();
        tracker.armDeferred(expiredPending.getId(), START.plus(Duration.ofHours(8)), DeferralKind.QUIET_HOURS, delivered::add);

        clock.advance(Duration.ofHours(1));
        int removed = tracker.removeExpired(clock.instant());

        assertThat(removed).isEqualTo(2);
        assertThat(tracker.find(expiredPending.getId())).isEmpty();
        assertThat(tracker.find(expiredRead.getId())).isEmpty();
        assertThat(tracker.find(live.getId())).isPresent();
        assertThat(tracker.find(noExpiry.getId())).isPresent();
        assertThat(tracker.getTrackedCount()).isEqualTo(2);

        deferredTaskScheduler.advance(Duration.ofHours(10));
        assertThat(delivered).isEmpty();
    }

    @Test
    void statusChange_publishesEvent() {
        Alert alert = registered();

        tracker.acknowledge(alert.getId());

        verify(alertEventPublisher).publishStatusChanged(eq(tracker), any(Alert.class), eq(AlertStatus.PENDING));
    }
}
