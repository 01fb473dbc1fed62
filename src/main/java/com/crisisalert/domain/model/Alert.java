package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.AlertType;
import com.crisisalert.domain.enums.NotificationChannel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A notification-worthy event routed through the delivery engine.
 *
 * <p>Alerts are built by {@link com.crisisalert.notification.AlertFactory}, registered with
 * the {@link com.crisisalert.notification.AlertLifecycleTracker} and then handed to the
 * delivery scheduler. The tracker owns the live instance; everything outside it works
 * on {@link #snapshot()} copies.
 *
 * <p>{@code channelOutcomes} keeps the per-channel result of the latest delivery attempt.
 * The overall {@code status} stays all-or-nothing (SENT only when every invoked channel
 * succeeded), the map is there to tell which channel failed.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class Alert {

    private String id;
    private AlertType type;
    private AlertPriority priority;
    private String title;
    private String message;
    private String userId;
    private Instant timestamp;
    private Instant expiresAt;

    @Builder.Default
    private Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);

    @Builder.Default
    private List<AlertAction> actions = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @Builder.Default
    private AlertStatus status = AlertStatus.PENDING;

    private boolean emergency;
    private boolean requiresAcknowledgment;

    @Builder.Default
    private Map<NotificationChannel, ChannelOutcome> channelOutcomes = new LinkedHashMap<>();

    /** Number of times the alert was handed to the channel dispatcher. */
    private int deliveryAttempts;

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /** Copy whose collections can be read and modified without touching this instance. */
    public Alert snapshot() {
        Alert copy = toBuilder().build();
        copy.setChannels(channels.isEmpty() ? EnumSet.noneOf(NotificationChannel.class) : EnumSet.copyOf(channels));
        copy.setActions(new ArrayList<>(actions));
        copy.setData(new HashMap<>(data));
        copy.setChannelOutcomes(new LinkedHashMap<>(channelOutcomes));
        return copy;
    }

    /** Clears the previous attempt so the alert can go through delivery again. */
    public void resetForRedelivery() {
        this.status = AlertStatus.PENDING;
        this.channelOutcomes = new LinkedHashMap<>();
    }
}
