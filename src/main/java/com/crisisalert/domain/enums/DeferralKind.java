package com.crisisalert.domain.enums;

/**
 * Reason a delivery was deferred.
 *
 * <ul>
 *   <li>QUIET_HOURS: alert stays PENDING and is delivered when the window ends</li>
 *   <li>SNOOZE: alert is DISMISSED now and re-enters as PENDING when the snooze elapses</li>
 * </ul>
 */
public enum DeferralKind {
    QUIET_HOURS,
    SNOOZE
}
