package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.ChannelOutcomeType;
import com.crisisalert.domain.enums.NotificationChannel;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Result of a single channel call during one delivery attempt. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelOutcome {

    private NotificationChannel channel;
    private ChannelOutcomeType type;
    private String error;
    private Instant completedAt;

    public boolean isSuccess() {
        return type == ChannelOutcomeType.SUCCESS;
    }

    public static ChannelOutcome success(NotificationChannel channel, Instant completedAt) {
        return new ChannelOutcome(channel, ChannelOutcomeType.SUCCESS, null, completedAt);
    }

    public static ChannelOutcome failure(
            NotificationChannel channel, ChannelOutcomeType type, String error, Instant completedAt) {
        return new ChannelOutcome(channel, type, error, completedAt);
    }
}
