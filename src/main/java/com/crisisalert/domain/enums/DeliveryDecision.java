package com.crisisalert.domain.enums;

/** Decision taken by the delivery scheduler for one submission of an alert. */
public enum DeliveryDecision {

    /** No preferences stored for the user; nothing was sent. */
    NO_PREFERENCES,

    /** Category disabled in preferences; alert dismissed without a send attempt. */
    SUPPRESSED,

    /** Inside quiet hours; a deferred task is armed for the end of the window. */
    DEFERRED,

    /** Handed to the channel dispatcher immediately. */
    DISPATCHED
}
