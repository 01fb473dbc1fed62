package com.crisisalert.domain.enums;

/** What happens when the user clicks an alert action. */
public enum ActionType {
    URL,
    CALL,
    CHAT,
    DISMISS,
    SNOOZE
}
