package com.crisisalert.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's unchecked exceptions. {@code details} ends up verbatim in the
 * {@code error.details} field of the REST error body, so it must not carry alert text
 * or contact data.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    /** 5xx codes: a gateway or engine fault rather than a bad request. */
    public boolean isServerSide() {
        return errorCode.getHttpStatus() >= 500;
    }
}
