package com.crisisalert.event;

import org.springframework.context.ApplicationEvent;

/** Published when the emergency-contact cascade for a crisis alert has finished. */
public class EscalationCompletedEvent extends ApplicationEvent {

    private final String alertId;
    private final int contactsNotified;
    private final int failedAttempts;

    public EscalationCompletedEvent(Object source, String alertId, int contactsNotified, int failedAttempts) {
        super(source);
        this.alertId = alertId;
        this.contactsNotified = contactsNotified;
        this.failedAttempts = failedAttempts;
    }

    public String getAlertId() {
        return alertId;
    }

    /** Number of distinct contacts the cascade attempted to reach. */
    public int getContactsNotified() {
        return contactsNotified;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }
}
