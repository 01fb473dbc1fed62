package com.crisisalert.domain.enums;

public enum ActionStyle {
    PRIMARY,
    SECONDARY,
    DANGER
}
