package com.crisisalert.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_ALERT("INVALID_ALERT", 422),
    INVALID_PREFERENCES("INVALID_PREFERENCES", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DISPATCH_FAILED("DISPATCH_FAILED", 502),
    CHANNEL_UNAVAILABLE("CHANNEL_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
