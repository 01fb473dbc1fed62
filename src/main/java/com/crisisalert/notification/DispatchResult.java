package com.crisisalert.notification;

import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.model.ChannelOutcome;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-channel outcomes of one dispatch. Only channels that were actually invoked appear.
 *
 * <p>The resulting alert status is all-or-nothing: SENT when every invoked channel succeeded,
 * FAILED otherwise. The outcome map keeps the detail the status cannot express.
 */
public record DispatchResult(Map<NotificationChannel, ChannelOutcome> outcomes) {

    public DispatchResult {
        outcomes = outcomes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(outcomes));
    }

    public boolean allSucceeded() {
        return outcomes.values().stream().allMatch(ChannelOutcome::isSuccess);
    }

    public AlertStatus resultingStatus() {
        return allSucceeded() ? AlertStatus.SENT : AlertStatus.FAILED;
    }

    public boolean wasInvoked(NotificationChannel channel) {
        return outcomes.containsKey(channel);
    }
}
