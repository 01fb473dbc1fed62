package com.crisisalert.domain.enums;

/** What the UI should do after an alert action was handled. */
public enum ActionOutcomeType {
    NAVIGATE,
    DIAL,
    SNOOZED,
    DISMISSED,
    IGNORED
}
