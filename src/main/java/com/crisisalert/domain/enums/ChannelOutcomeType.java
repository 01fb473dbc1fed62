package com.crisisalert.domain.enums;

/**
 * Result of one channel call within a dispatch.
 *
 * <p>UNAVAILABLE means the sink could not be called at all (not configured, permission
 * denied, or no executor thread free),
 * FAILED is a send error reported by the sink, TIMED_OUT means the sink did not
 * answer within the configured channel timeout.
 */
public enum ChannelOutcomeType {
    SUCCESS,
    FAILED,
    UNAVAILABLE,
    TIMED_OUT
}
