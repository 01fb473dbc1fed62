package com.crisisalert.event;

import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.AlertType;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the lifecycle tracker on every status transition of a tracked alert.
 * Listeners run synchronously while the alert's lock is held and must not block.
 */
public class AlertStatusChangedEvent extends ApplicationEvent {

    private final String alertId;
    private final String userId;
    private final AlertType alertType;
    private final AlertStatus previousStatus;
    private final AlertStatus newStatus;

    public AlertStatusChangedEvent(
            Object source,
            String alertId,
            String userId,
            AlertType alertType,
            AlertStatus previousStatus,
            AlertStatus newStatus) {
        super(source);
        this.alertId = alertId;
        this.userId = userId;
        this.alertType = alertType;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getUserId() {
        return userId;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public AlertStatus getPreviousStatus() {
        return previousStatus;
    }

    public AlertStatus getNewStatus() {
        return newStatus;
    }
}
