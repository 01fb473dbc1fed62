package com.crisisalert.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.DeliveryDecision;
import com.crisisalert.domain.enums.ReminderType;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.CrisisAlert;
import com.crisisalert.domain.model.CrisisAlertDraft;
import com.crisisalert.unit.support.EngineFixture;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DeliveryScheduler.
 *
 * <p>Verifies: quiet-hours deferral, the critical bypass, category suppression,
 * user time zones, and emergency contact escalation.
 */
class DeliverySchedulerTest {

    private static final Instant LATE_EVENING = Instant.parse("2026-03-10T23:00:00Z");

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(LATE_EVENING);
    }

    private Alert reminder() {
        return engine.notificationService.sendReminder(EngineFixture.USER_ID, ReminderType.MEDICATION, null);
    }

    private Alert crisis() {
        return engine.notificationService.sendCrisisAlert(
                CrisisAlertDraft.builder().userId(EngineFixture.USER_ID).build());
    }

    @Nested
    class QuietHoursDeferral {

        @BeforeEach
        void nightWindow() {
            engine.savePreferences(EngineFixture.preferences()
                    .quietHours(EngineFixture.quietHours("22:00", "08:00"))
                    .build());
        }

        @Test
        void reminderDuringQuietHours_heldUntilWindowEnds() {
            Alert alert = reminder();

            assertThat(alert.getStatus()).isEqualTo(AlertStatus.PENDING);
            assertThat(engine.tracker.getDeferredUntil(alert.getId()))
                    .contains(Instant.parse("2026-03-11T08:00:00Z"));
            verify(engine.pushSink, never()).send(anyString(), any(), any(), any());
            verify(engine.inAppSink, never()).publish(any());
        }

        @Test
        void deferredReminder_sentOnceWhenWindowEnds() {
            Alert alert = reminder();

            engine.deferredTaskScheduler.advance(Duration.ofHours(8).minusMinutes(1));
            verify(engine.pushSink, never()).send(anyString(), any(), any(), any());

            engine.deferredTaskScheduler.advance(Duration.ofHours(1).plusMinutes(1));

            verify(engine.pushSink, times(1)).send(eq(EngineFixture.USER_ID), any(), any(), any());
            Alert delivered = engine.tracker.find(alert.getId()).orElseThrow();
            assertThat(delivered.getStatus()).isEqualTo(AlertStatus.SENT);
            assertThat(delivered.getDeliveryAttempts()).isEqualTo(1);
            assertThat(engine.tracker.hasArmedTask(alert.getId())).isFalse();
        }

        @Test
        void dismissedWhileDeferred_neverSent() {
            Alert alert = reminder();

            engine.notificationService.dismiss(alert.getId());
            engine.deferredTaskScheduler.advance(Duration.ofHours(10));

            verify(engine.pushSink, never()).send(anyString(), any(), any(), any());
            assertThat(engine.tracker.find(alert.getId()).orElseThrow().getStatus())
                    .isEqualTo(AlertStatus.DISMISSED);
        }

        @Test
        void crisisAlert_dispatchedImmediately() {
            Alert alert = crisis();

            verify(engine.pushSink).send(eq(EngineFixture.USER_ID), any(), any(), any());
            verify(engine.smsSink).send(eq("+15550000001"), anyString());
            verify(engine.inAppSink).publish(any());
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.SENT);
            assertThat(engine.tracker.hasArmedTask(alert.getId())).isFalse();
        }

        @Test
        void highPriority_stillDeferred() {
            Alert alert = engine.alertFactory.createReminder(EngineFixture.USER_ID, ReminderType.THERAPY, null);
            alert.setPriority(AlertPriority.HIGH);
            engine.tracker.register(alert);

            assertThat(engine.deliveryScheduler.deliver(alert)).isEqualTo(DeliveryDecision.DEFERRED);
        }
    }

    @Test
    void criticalPriority_ignoresEveryQuietWindow() {
        String[][] windows = {{"00:00", "23:59"}, {"22:00", "08:00"}, {"23:00", "23:00"}};
        for (String[] window : windows) {
            EngineFixture fixture = new EngineFixture(LATE_EVENING);
            fixture.savePreferences(EngineFixture.preferences()
                    .quietHours(EngineFixture.quietHours(window[0], window[1]))
                    .build());

            Alert alert = fixture.alertFactory.createReminder(EngineFixture.USER_ID, ReminderType.MEDICATION, null);
            alert.setPriority(AlertPriority.CRITICAL);
            fixture.tracker.register(alert);

            assertThat(fixture.deliveryScheduler.deliver(alert)).isEqualTo(DeliveryDecision.DISPATCHED);
        }
    }

    @Test
    void disabledQuietHours_notApplied() {
        engine.savePreferences(EngineFixture.preferences()
                .quietHours(EngineFixture.quietHours("22:00", "08:00").toBuilder().enabled(false).build())
                .build());

        assertThat(reminder().getStatus()).isEqualTo(AlertStatus.SENT);
    }

    @Test
    void disabledCategory_alertDismissedAndNothingSent() {
        engine.savePreferences(EngineFixture.preferences().reminderAlerts(false).build());

        Alert alert = reminder();

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.DISMISSED);
        verify(engine.pushSink, never()).send(anyString(), any(), any(), any());
        verify(engine.inAppSink, never()).publish(any());
    }

    @Test
    void noPreferences_alertStaysPending() {
        Alert alert = engine.alertFactory.createReminder(EngineFixture.USER_ID, ReminderType.JOURNAL, null);
        engine.tracker.register(alert);

        assertThat(engine.deliveryScheduler.deliver(alert)).isEqualTo(DeliveryDecision.NO_PREFERENCES);
        assertThat(engine.tracker.find(alert.getId()).orElseThrow().getStatus()).isEqualTo(AlertStatus.PENDING);
        verify(engine.inAppSink, never()).publish(any());
    }

    @Test
    void userTimezone_decidesQuietHours() {
        // 23:00 UTC is 19:00 in New York (EDT)
        engine.savePreferences(EngineFixture.preferences()
                .timezone("America/New_York")
                .quietHours(EngineFixture.quietHours("18:00", "20:00"))
                .build());

        Alert alert = reminder();

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.PENDING);
        assertThat(engine.tracker.getDeferredUntil(alert.getId()))
                .contains(Instant.parse("2026-03-11T00:00:00Z"));
    }

    @Test
    void userTimezone_outsideLocalWindow_sentNow() {
        engine.savePreferences(EngineFixture.preferences()
                .timezone("America/New_York")
                .quietHours(EngineFixture.quietHours("22:00", "08:00"))
                .build());

        assertThat(reminder().getStatus()).isEqualTo(AlertStatus.SENT);
    }

    @Test
    void crisisWithoutContactAlerts_noContactMessages() {
        engine.savePreferences(EngineFixture.preferences()
                .emergencyContactAlerts(false)
                .emergencyContacts(EngineFixture.contacts(EngineFixture.contact("Ann", 1)))
                .build());

        CrisisAlert alert = (CrisisAlert) crisis();

        verify(engine.smsSink, never()).send(eq("+15551"), anyString());
        verify(engine.emailSink, never()).send(eq("ann@example.com"), any(), any(), any());
        assertThat(alert.isEmergencyContactsNotified()).isFalse();
    }

    @Test
    void crisisWithContactAlerts_contactsNotified() {
        engine.savePreferences(EngineFixture.preferences()
                .emergencyContacts(EngineFixture.contacts(EngineFixture.contact("Ann", 1)))
                .build());

        CrisisAlert alert = (CrisisAlert) crisis();

        verify(engine.smsSink).send(eq("+15551"), anyString());
        verify(engine.emailSink).send(eq("ann@example.com"), any(), any(), any());
        assertThat(alert.isEmergencyContactsNotified()).isTrue();
        assertThat(alert.getContactNotifications()).hasSize(2);
    }

    @Test
    void smsFailure_alertFailedButOtherChannelsDelivered() {
        engine.savePreferences(EngineFixture.preferences().phoneNumber(null).build());

        Alert alert = crisis();

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FAILED);
        verify(engine.pushSink).send(eq(EngineFixture.USER_ID), any(), any(), any());
        verify(engine.inAppSink).publish(any());
    }
}
