package com.crisisalert.domain.enums;

/**
 * Category of an alert. Each category maps to one per-user preference toggle,
 * which decides whether alerts of that category are delivered at all.
 *
 * <p>CRISIS and EMERGENCY both count as crisis alerts: they use the crisis toggle
 * and are the only types that trigger the emergency-contact cascade.
 */
public enum AlertType {
    CRISIS,
    REMINDER,
    CHECK_IN,
    EMERGENCY,
    THERAPY,
    SUPPORT;

    public boolean isCrisis() {
        return this == CRISIS || this == EMERGENCY;
    }
}
