package com.crisisalert.event;

import com.crisisalert.domain.enums.ChannelOutcomeType;
import com.crisisalert.domain.enums.NotificationChannel;
import org.springframework.context.ApplicationEvent;

/** Published once per failed, unavailable or timed-out channel call. */
public class ChannelDeliveryFailedEvent extends ApplicationEvent {

    private final String alertId;
    private final NotificationChannel channel;
    private final ChannelOutcomeType outcomeType;
    private final String error;

    public ChannelDeliveryFailedEvent(
            Object source, String alertId, NotificationChannel channel, ChannelOutcomeType outcomeType, String error) {
        super(source);
        this.alertId = alertId;
        this.channel = channel;
        this.outcomeType = outcomeType;
        this.error = error;
    }

    public String getAlertId() {
        return alertId;
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public ChannelOutcomeType getOutcomeType() {
        return outcomeType;
    }

    public String getError() {
        return error;
    }
}
