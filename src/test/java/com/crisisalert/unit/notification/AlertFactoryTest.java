package com.crisisalert.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.enums.ActionStyle;
import com.crisisalert.domain.enums.ActionType;
import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.AlertType;
import com.crisisalert.domain.enums.EscalationLevel;
import com.crisisalert.domain.enums.MoodTrend;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.enums.ReminderType;
import com.crisisalert.domain.enums.TriggerSource;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.AlertAction;
import com.crisisalert.domain.model.CrisisAlert;
import com.crisisalert.domain.model.CrisisAlertDraft;
import com.crisisalert.exception.InvalidAlertException;
import com.crisisalert.notification.AlertFactory;
import com.crisisalert.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AlertFactory.
 *
 * <p>Verifies: crisis alert construction by risk level, reminder templates,
 * wellness check-in actions, and draft validation.
 */
class AlertFactoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private AlertFactory alertFactory;

    @BeforeEach
    void setUp() {
        alertFactory = new AlertFactory(new MutableClock(NOW, ZoneOffset.UTC), new NotificationProperties());
    }

    @Test
    void crisisAlert_appliesCrisisDefaults() {
        CrisisAlert alert = alertFactory.createCrisisAlert(
                CrisisAlertDraft.builder().userId("user-1").build());

        assertThat(alert.getId()).isNotBlank();
        assertThat(alert.getTimestamp()).isEqualTo(NOW);
        assertThat(alert.getType()).isEqualTo(AlertType.CRISIS);
        assertThat(alert.getPriority()).isEqualTo(AlertPriority.CRITICAL);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.PENDING);
        assertThat(alert.getChannels())
                .containsExactlyInAnyOrder(NotificationChannel.PUSH, NotificationChannel.SMS, NotificationChannel.IN_APP);
        assertThat(alert.isEmergency()).isTrue();
        assertThat(alert.isRequiresAcknowledgment()).isTrue();
        assertThat(alert.getRiskLevel()).isEqualTo(8);
        assertThat(alert.getTriggerSource()).isEqualTo(TriggerSource.AI_DETECTION);
        assertThat(alert.isInterventionRequired()).isTrue();
        assertThat(alert.getEscalationLevel()).isEqualTo(EscalationLevel.IMMEDIATE);
        assertThat(alert.isEmergencyContactsNotified()).isFalse();
        assertThat(alert.getActions())
                .extracting(AlertAction::getId)
                .containsExactly("call-988", "crisis-chat", "safety-plan");

        AlertAction call = alert.getActions().get(0);
        assertThat(call.getType()).isEqualTo(ActionType.CALL);
        assertThat(call.getTarget()).isEqualTo("988");
        assertThat(call.getStyle()).isEqualTo(ActionStyle.DANGER);
    }

    @Test
    void crisisAlert_draftOverridesDefaults() {
        CrisisAlert alert = alertFactory.createCrisisAlert(CrisisAlertDraft.builder()
                .userId("user-1")
                .type(AlertType.EMERGENCY)
                .priority(AlertPriority.HIGH)
                .title("Check-in needed")
                .channels(Set.of(NotificationChannel.EMAIL))
                .emergency(false)
                .riskLevel(4)
                .triggerSource(TriggerSource.THERAPIST_ALERT)
                .escalationLevel(EscalationLevel.SCHEDULED)
                .build());

        assertThat(alert.getType()).isEqualTo(AlertType.EMERGENCY);
        assertThat(alert.getPriority()).isEqualTo(AlertPriority.HIGH);
        assertThat(alert.getTitle()).isEqualTo("Check-in needed");
        assertThat(alert.getChannels()).containsExactly(NotificationChannel.EMAIL);
        assertThat(alert.isEmergency()).isFalse();
        assertThat(alert.getRiskLevel()).isEqualTo(4);
        assertThat(alert.getTriggerSource()).isEqualTo(TriggerSource.THERAPIST_ALERT);
        assertThat(alert.getEscalationLevel()).isEqualTo(EscalationLevel.SCHEDULED);
        assertThat(alert.isRequiresAcknowledgment()).isTrue();
    }

    @Test
    void crisisAlert_alwaysGetsFreshId() {
        CrisisAlertDraft draft = CrisisAlertDraft.builder().userId("user-1").build();

        CrisisAlert first = alertFactory.createCrisisAlert(draft);
        CrisisAlert second = alertFactory.createCrisisAlert(draft);

        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    void crisisAlert_hotlineFollowsConfiguration() {
        NotificationProperties properties = new NotificationProperties();
        properties.setCrisisHotline("116123");
        AlertFactory factory = new AlertFactory(new MutableClock(NOW, ZoneOffset.UTC), properties);

        CrisisAlert alert = factory.createCrisisAlert(CrisisAlertDraft.builder().userId("user-1").build());

        assertThat(alert.getActions().get(0).getTarget()).isEqualTo("116123");
    }

    @Test
    void crisisAlert_invalidInput_throws() {
        assertThatThrownBy(() -> alertFactory.createCrisisAlert(CrisisAlertDraft.builder().build()))
                .isInstanceOf(InvalidAlertException.class);
        assertThatThrownBy(() -> alertFactory.createCrisisAlert(
                        CrisisAlertDraft.builder().userId("user-1").riskLevel(11).build()))
                .isInstanceOf(InvalidAlertException.class);
        assertThatThrownBy(() -> alertFactory.createCrisisAlert(
                        CrisisAlertDraft.builder().userId("user-1").riskLevel(0).build()))
                .isInstanceOf(InvalidAlertException.class);
    }

    @Test
    void reminder_usesCannedMessageAndExpiresInADay() {
        Alert alert = alertFactory.createReminder("user-1", ReminderType.MOOD_CHECK, null);

        assertThat(alert.getType()).isEqualTo(AlertType.REMINDER);
        assertThat(alert.getPriority()).isEqualTo(AlertPriority.MEDIUM);
        assertThat(alert.getTitle()).isEqualTo("Wellness Reminder - Mood Check");
        assertThat(alert.getMessage()).isEqualTo(ReminderType.MOOD_CHECK.getDefaultMessage());
        assertThat(alert.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(alert.getChannels()).containsExactlyInAnyOrder(NotificationChannel.PUSH, NotificationChannel.IN_APP);
        assertThat(alert.getActions()).extracting(AlertAction::getId).containsExactly("open-app", "snooze");
        assertThat(alert.getActions().get(1).getType()).isEqualTo(ActionType.SNOOZE);
        assertThat(alert.getActions().get(1).getTarget()).isEqualTo("1h");
    }

    @Test
    void reminder_customMessageWins() {
        Alert alert = alertFactory.createReminder("user-1", ReminderType.MEDICATION, "Take the blue one");

        assertThat(alert.getTitle()).isEqualTo("Wellness Reminder - Medication");
        assertThat(alert.getMessage()).isEqualTo("Take the blue one");
    }

    @Test
    void checkIn_concerning_isHighWithCrisisAction() {
        Alert alert = alertFactory.createWellnessCheckIn("user-1", MoodTrend.CONCERNING);

        assertThat(alert.getType()).isEqualTo(AlertType.CHECK_IN);
        assertThat(alert.getPriority()).isEqualTo(AlertPriority.HIGH);
        assertThat(alert.getTitle()).isEqualTo("Daily Check-in");
        assertThat(alert.getMessage()).isEqualTo(MoodTrend.CONCERNING.getCheckInMessage());
        assertThat(alert.getActions())
                .extracting(AlertAction::getId)
                .containsExactly("mood-tracking", "ai-therapy", "crisis-support");
    }

    @Test
    void checkIn_stableOrImproving_isMediumWithoutCrisisAction() {
        for (MoodTrend trend : new MoodTrend[] {MoodTrend.STABLE, MoodTrend.IMPROVING}) {
            Alert alert = alertFactory.createWellnessCheckIn("user-1", trend);

            assertThat(alert.getPriority()).isEqualTo(AlertPriority.MEDIUM);
            assertThat(alert.getActions()).extracting(AlertAction::getId).containsExactly("mood-tracking", "ai-therapy");
        }
    }
}
