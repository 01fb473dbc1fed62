package com.crisisalert.api.dto.response;

import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Success envelope added by {@code ApiResponseAdvice} around every body returned from
 * the notification API. Error bodies use {@link ApiErrorResponse} instead.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
