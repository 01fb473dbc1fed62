package com.crisisalert.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.crisisalert.domain.enums.ActionOutcomeType;
import com.crisisalert.domain.enums.ActionType;
import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.ReminderType;
import com.crisisalert.domain.model.ActionOutcome;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.AlertAction;
import com.crisisalert.domain.model.CrisisAlertDraft;
import com.crisisalert.unit.support.EngineFixture;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ActionHandler.
 *
 * <p>Verifies: hotline dialing, crisis chat navigation, snooze and dismiss
 * actions, and ignored unknown actions.
 */
class ActionHandlerTest {

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(Instant.parse("2026-03-10T12:00:00Z"));
        engine.savePreferences(EngineFixture.preferences().build());
    }

    private Alert crisis() {
        return engine.notificationService.sendCrisisAlert(
                CrisisAlertDraft.builder().userId(EngineFixture.USER_ID).build());
    }

    private AlertStatus statusOf(Alert alert) {
        return engine.notificationService.getAlert(alert.getId()).getStatus();
    }

    @Test
    void callAction_dialsHotlineAndMarksRead() {
        Alert alert = crisis();

        ActionOutcome outcome = engine.actionHandler.handle(alert.getId(), "call-988");

        assertThat(outcome.getType()).isEqualTo(ActionOutcomeType.DIAL);
        assertThat(outcome.getTarget()).isEqualTo("tel:988");
        assertThat(statusOf(alert)).isEqualTo(AlertStatus.READ);
    }

    @Test
    void chatAction_navigatesAndMarksRead() {
        Alert alert = crisis();

        ActionOutcome outcome = engine.actionHandler.handle(alert.getId(), "crisis-chat");

        assertThat(outcome.getType()).isEqualTo(ActionOutcomeType.NAVIGATE);
        assertThat(outcome.getTarget()).isEqualTo("/crisis/chat");
        assertThat(statusOf(alert)).isEqualTo(AlertStatus.READ);
    }

    @Test
    void snoozeAction_dismissesWithoutMarkingRead() {
        Alert alert = engine.notificationService.sendReminder(EngineFixture.USER_ID, ReminderType.MEDICATION, null);

        ActionOutcome outcome = engine.actionHandler.handle(alert.getId(), "snooze");

        assertThat(outcome.getType()).isEqualTo(ActionOutcomeType.SNOOZED);
        assertThat(outcome.getTarget()).isEqualTo("1h");
        assertThat(statusOf(alert)).isEqualTo(AlertStatus.DISMISSED);
        assertThat(engine.tracker.hasArmedTask(alert.getId())).isTrue();
    }

    @Test
    void snoozeAction_malformedDuration_ignored() {
        Alert draft = engine.alertFactory.createReminder(EngineFixture.USER_ID, ReminderType.MEDICATION, null);
        draft.setActions(List.of(AlertAction.builder()
                .id("snooze")
                .label("Later")
                .type(ActionType.SNOOZE)
                .target("soon")
                .build()));
        Alert alert = engine.notificationService.send(draft);

        ActionOutcome outcome = engine.actionHandler.handle(alert.getId(), "snooze");

        assertThat(outcome.getType()).isEqualTo(ActionOutcomeType.IGNORED);
        assertThat(statusOf(alert)).isEqualTo(AlertStatus.SENT);
    }

    @Test
    void dismissAction_dismissesAlert() {
        Alert draft = engine.alertFactory.createReminder(EngineFixture.USER_ID, ReminderType.MEDICATION, null);
        draft.setActions(List.of(AlertAction.builder()
                .id("dismiss")
                .label("Dismiss")
                .type(ActionType.DISMISS)
                .build()));
        Alert alert = engine.notificationService.send(draft);

        ActionOutcome outcome = engine.actionHandler.handle(alert.getId(), "dismiss");

        assertThat(outcome.getType()).isEqualTo(ActionOutcomeType.DISMISSED);
        assertThat(statusOf(alert)).isEqualTo(AlertStatus.DISMISSED);
    }

    @Test
    void unknownAction_ignoredAndStatusUnchanged() {
        Alert alert = crisis();

        assertThat(engine.actionHandler.handle(alert.getId(), "no-such-action").getType())
                .isEqualTo(ActionOutcomeType.IGNORED);
        assertThat(statusOf(alert)).isEqualTo(AlertStatus.SENT);
    }

    @Test
    void unknownAlert_ignored() {
        assertThat(engine.actionHandler.handle("missing", "call-988").getType())
                .isEqualTo(ActionOutcomeType.IGNORED);
    }
}
