package com.crisisalert.domain.enums;

/**
 * Lifecycle status of a tracked alert.
 *
 * <p>Transitions: PENDING -> SENT -> DELIVERED -> READ -> DISMISSED. Any state may move
 * to FAILED on a dispatch error. PENDING may go straight to DISMISSED when the alert's
 * category is disabled, or stay PENDING while a quiet-hours deferral is armed.
 */
public enum AlertStatus {
    PENDING,
    SENT,
    DELIVERED,
    READ,
    DISMISSED,
    FAILED;

    /** Statuses reported by active-alert queries. */
    public boolean isActive() {
        return this == PENDING || this == SENT || this == DELIVERED;
    }
}
