package com.crisisalert.domain.enums;

/** How quickly a crisis alert expects human intervention. */
public enum EscalationLevel {
    IMMEDIATE,
    URGENT,
    SCHEDULED
}
