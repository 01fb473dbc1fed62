package com.crisisalert.notification;

import com.crisisalert.domain.enums.ActionOutcomeType;
import com.crisisalert.domain.model.ActionOutcome;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.AlertAction;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a click on an alert action into an engine call plus an instruction for the UI.
 *
 * <ul>
 *   <li>URL, CHAT: alert READ, UI navigates to the target</li>
 *   <li>CALL: alert READ, UI dials {@code tel:<target>}</li>
 *   <li>SNOOZE: alert snoozed for the target duration; IGNORED if the duration is malformed</li>
 *   <li>DISMISS: alert dismissed</li>
 * </ul>
 *
 * Snoozing does not mark the alert READ; it has to stay DISMISSED until the snooze elapses.
 * Unknown alert or action ids are IGNORED.
 */
@Component
public class ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ActionHandler.class);

    private final NotificationService notificationService;
    private final AlertLifecycleTracker alertLifecycleTracker;

    public ActionHandler(NotificationService notificationService, AlertLifecycleTracker alertLifecycleTracker) {
        this.notificationService = notificationService;
        this.alertLifecycleTracker = alertLifecycleTracker;
    }

    public ActionOutcome handle(String alertId, String actionId) {
        Optional<AlertAction> found = alertLifecycleTracker.find(alertId).flatMap(alert -> findAction(alert, actionId));
        if (found.isEmpty()) {
            log.debug("Action ignored: alertId={}, actionId={}", alertId, actionId);
            return ActionOutcome.ignored(alertId);
        }

        AlertAction action = found.get();
        return switch (action.getType()) {
            case URL, CHAT -> {
                notificationService.acknowledge(alertId);
                yield new ActionOutcome(alertId, ActionOutcomeType.NAVIGATE, action.getTarget());
            }
            case CALL -> {
                notificationService.acknowledge(alertId);
                yield new ActionOutcome(alertId, ActionOutcomeType.DIAL, "tel:" + action.getTarget());
            }
            case SNOOZE -> notificationService.snooze(alertId, action.getTarget())
                    ? new ActionOutcome(alertId, ActionOutcomeType.SNOOZED, action.getTarget())
                    : ActionOutcome.ignored(alertId);
            case DISMISS -> {
                notificationService.dismiss(alertId);
                yield new ActionOutcome(alertId, ActionOutcomeType.DISMISSED, null);
            }
        };
    }

    private static Optional<AlertAction> findAction(Alert alert, String actionId) {
        return alert.getActions().stream()
                .filter(action -> action.getId().equals(actionId))
                .findFirst();
    }
}
