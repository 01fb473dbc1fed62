package com.crisisalert.domain.enums;

/** Origin of a crisis alert. */
public enum TriggerSource {
    AI_DETECTION,
    USER_REQUEST,
    THERAPIST_ALERT,
    AUTO_CHECK_IN
}
