package com.crisisalert.notification;

import com.crisisalert.domain.enums.DeliveryDecision;
import com.crisisalert.domain.enums.MoodTrend;
import com.crisisalert.domain.enums.ReminderType;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.CrisisAlertDraft;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.exception.ResourceNotFoundException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the alert delivery engine.
 *
 * <p>Builds alerts through the {@link AlertFactory}, registers them with the
 * {@link AlertLifecycleTracker} and submits them to the {@link DeliveryScheduler}. Sending
 * never throws for delivery problems: the returned alert carries the status reached
 * (PENDING when deferred or when the user has no preferences, DISMISSED when suppressed,
 * SENT or FAILED after dispatch). Only malformed input throws.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final AlertFactory alertFactory;
    private final AlertLifecycleTracker alertLifecycleTracker;
    private final DeliveryScheduler deliveryScheduler;
    private final PreferenceStore preferenceStore;

    public NotificationService(
            AlertFactory alertFactory,
            AlertLifecycleTracker alertLifecycleTracker,
            DeliveryScheduler deliveryScheduler,
            PreferenceStore preferenceStore) {
        this.alertFactory = alertFactory;
        this.alertLifecycleTracker = alertLifecycleTracker;
        this.deliveryScheduler = deliveryScheduler;
        this.preferenceStore = preferenceStore;
    }

    public Alert sendCrisisAlert(CrisisAlertDraft draft) {
        return send(alertFactory.createCrisisAlert(draft));
    }

    public Alert sendReminder(String userId, ReminderType reminderType, String customMessage) {
        return send(alertFactory.createReminder(userId, reminderType, customMessage));
    }

    public Alert sendWellnessCheckIn(String userId, MoodTrend moodTrend) {
        return send(alertFactory.createWellnessCheckIn(userId, moodTrend));
    }

    /** Registers a prebuilt alert and submits it for delivery. */
    public Alert send(Alert alert) {
        Alert registered = alertLifecycleTracker.register(alert);
        DeliveryDecision decision = deliveryScheduler.deliver(registered);
        log.info(
                "Alert submitted: alertId={}, userId={}, type={}, priority={}, decision={}",
                registered.getId(),
                registered.getUserId(),
                registered.getType(),
                registered.getPriority(),
                decision);
        return alertLifecycleTracker.find(registered.getId()).orElse(registered);
    }

    public Alert acknowledge(String alertId) {
        return alertLifecycleTracker.acknowledge(alertId).orElseThrow(() -> notFound(alertId));
    }

    public Alert dismiss(String alertId) {
        return alertLifecycleTracker.dismiss(alertId).orElseThrow(() -> notFound(alertId));
    }

    public Alert markDelivered(String alertId) {
        return alertLifecycleTracker.markDelivered(alertId).orElseThrow(() -> notFound(alertId));
    }

    /**
     * Dismisses the alert now and re-submits it after the given {@code <N>h}/{@code <N>m} duration.
     *
     * @return false, leaving the alert untouched, when the token cannot be parsed
     */
    public boolean snooze(String alertId, String durationToken) {
        if (alertLifecycleTracker.find(alertId).isEmpty()) {
            throw notFound(alertId);
        }

        Optional<Duration> duration = SnoozeDuration.parse(durationToken);
        if (duration.isEmpty()) {
            log.warn("Unparseable snooze duration ignored: alertId={}, token={}", alertId, durationToken);
            return false;
        }

        return alertLifecycleTracker
                .snooze(alertId, duration.get(), deliveryScheduler::deliver)
                .isPresent();
    }

    public Alert getAlert(String alertId) {
        return alertLifecycleTracker.find(alertId).orElseThrow(() -> notFound(alertId));
    }

    public List<Alert> getActiveAlerts(String userId) {
        return alertLifecycleTracker.getActiveAlerts(userId);
    }

    public NotificationPreferences setPreferences(NotificationPreferences preferences) {
        return preferenceStore.set(preferences);
    }

    public Optional<NotificationPreferences> getPreferences(String userId) {
        return preferenceStore.get(userId);
    }

    private static ResourceNotFoundException notFound(String alertId) {
        return new ResourceNotFoundException("Alert", alertId);
    }
}
