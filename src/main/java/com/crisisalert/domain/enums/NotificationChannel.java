package com.crisisalert.domain.enums;

/**
 * Delivery channels for alerts.
 * IN_APP is local to the platform and always attempted for emergencies; the other
 * three go through external providers and can be unavailable or fail independently.
 */
public enum NotificationChannel {
    PUSH,
    SMS,
    EMAIL,
    IN_APP;

    public boolean isExternal() {
        return this != IN_APP;
    }
}
