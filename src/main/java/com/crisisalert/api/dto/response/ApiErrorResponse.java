package com.crisisalert.api.dto.response;

import com.crisisalert.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error body returned by {@code GlobalExceptionHandler}:
 * <pre>
 * {"success": false, "error": {"code": "NOT_FOUND", "status": 404, "message": "...", "details": {...},
 *  "timestamp": "...", "path": "/api/notifications/alerts/42"}}
 * </pre>
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Value
    @Builder
    public static class ErrorDetail {
        String code;
        int status;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
