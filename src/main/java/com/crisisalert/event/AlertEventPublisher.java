package com.crisisalert.event;

import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.ChannelOutcome;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the
 * delivery engine's events.
 */
@Component
public class AlertEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public AlertEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishStatusChanged(Object source, Alert alert, AlertStatus previousStatus) {
        applicationEventPublisher.publishEvent(new AlertStatusChangedEvent(
                source, alert.getId(), alert.getUserId(), alert.getType(), previousStatus, alert.getStatus()));
    }

    public void publishChannelFailure(Object source, String alertId, ChannelOutcome outcome) {
        applicationEventPublisher.publishEvent(new ChannelDeliveryFailedEvent(
                source, alertId, outcome.getChannel(), outcome.getType(), outcome.getError()));
    }

    public void publishEscalationCompleted(Object source, String alertId, int contactsNotified, int failedAttempts) {
        applicationEventPublisher.publishEvent(
                new EscalationCompletedEvent(source, alertId, contactsNotified, failedAttempts));
    }
}
