package com.crisisalert.exception;

import java.util.Map;

/** Thrown synchronously when an alert cannot be constructed from the supplied fields. */
public class InvalidAlertException extends BaseException {

    public InvalidAlertException(String message) {
        super(ErrorCode.INVALID_ALERT, message);
    }

    public InvalidAlertException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_ALERT, message, details);
    }
}
