package com.crisisalert.exception;

import com.crisisalert.domain.enums.NotificationChannel;
import java.util.Map;
import lombok.Getter;

/**
 * A delivery channel cannot be used at all: the sink is not configured or the
 * provider denied permission. Only the affected channel is marked unavailable.
 */
@Getter
public class ChannelUnavailableException extends BaseException {

    private final NotificationChannel channel;

    public ChannelUnavailableException(NotificationChannel channel, String message) {
        super(ErrorCode.CHANNEL_UNAVAILABLE, message, Map.of("channel", channel.name()));
        this.channel = channel;
    }
}
