package com.crisisalert.domain.enums;

/**
 * Delivery priority of an alert.
 *
 * <p>Only CRITICAL bypasses quiet hours. Every other priority is deferred
 * until the quiet-hours window ends.
 */
public enum AlertPriority {

    /** Life-safety alerts. Never deferred. */
    CRITICAL,

    HIGH,
    MEDIUM,
    LOW
}
