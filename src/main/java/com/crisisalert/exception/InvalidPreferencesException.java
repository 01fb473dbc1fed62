package com.crisisalert.exception;

import java.util.Map;

public class InvalidPreferencesException extends BaseException {

    public InvalidPreferencesException(String message) {
        super(ErrorCode.INVALID_PREFERENCES, message);
    }

    public InvalidPreferencesException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_PREFERENCES, message, details);
    }
}
