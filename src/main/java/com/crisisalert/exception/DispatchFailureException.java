package com.crisisalert.exception;

import com.crisisalert.domain.enums.NotificationChannel;
import java.util.Map;
import lombok.Getter;

/**
 * Transient send error reported by a sink. The engine never retries; retry policy
 * belongs to the sink implementation.
 */
@Getter
public class DispatchFailureException extends BaseException {

    private final NotificationChannel channel;

    public DispatchFailureException(NotificationChannel channel, String message) {
        super(ErrorCode.DISPATCH_FAILED, message, Map.of("channel", channel.name()));
        this.channel = channel;
    }

    public DispatchFailureException(NotificationChannel channel, String message, Throwable cause) {
        super(ErrorCode.DISPATCH_FAILED, message, Map.of("channel", channel.name()), cause);
        this.channel = channel;
    }
}
