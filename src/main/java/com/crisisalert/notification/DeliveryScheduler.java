package com.crisisalert.notification;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.DeferralKind;
import com.crisisalert.domain.enums.DeliveryDecision;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.NotificationPreferences;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides, for one submission of a tracked alert, whether it is sent now, held until quiet
 * hours end, or not sent at all.
 *
 * <ol>
 *   <li>No preferences stored: logged and skipped, the alert stays PENDING.</li>
 *   <li>Category disabled: alert DISMISSED, nothing sent.</li>
 *   <li>Not CRITICAL and inside quiet hours: a deferred task is armed for the end of the
 *       window, the alert stays PENDING.</li>
 *   <li>Otherwise: dispatched to the channels now. Crisis alerts start the emergency-contact
 *       cascade alongside the dispatch.</li>
 * </ol>
 *
 * <p>Quiet hours are evaluated in the user's timezone, falling back to the engine zone.
 * Delivery failures end up in the alert's status; nothing here throws to the caller.
 */
@Service
public class DeliveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeliveryScheduler.class);

    private final PreferenceStore preferenceStore;
    private final QuietHoursPolicy quietHoursPolicy;
    private final ChannelDispatcher channelDispatcher;
    private final EscalationCascade escalationCascade;
    private final AlertLifecycleTracker alertLifecycleTracker;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    public DeliveryScheduler(
            PreferenceStore preferenceStore,
            QuietHoursPolicy quietHoursPolicy,
            ChannelDispatcher channelDispatcher,
            EscalationCascade escalationCascade,
            AlertLifecycleTracker alertLifecycleTracker,
            NotificationProperties notificationProperties,
            Clock clock) {
        this.preferenceStore = preferenceStore;
        this.quietHoursPolicy = quietHoursPolicy;
        this.channelDispatcher = channelDispatcher;
        this.escalationCascade = escalationCascade;
        this.alertLifecycleTracker = alertLifecycleTracker;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    public DeliveryDecision deliver(Alert alert) {
        return evaluate(alert, true);
    }

    /**
     * @param honourQuietHours false when a quiet-hours deferral fires; the window end is
     *                         inclusive, so re-checking at that minute would defer again
     */
    DeliveryDecision evaluate(Alert alert, boolean honourQuietHours) {
        Optional<NotificationPreferences> found = preferenceStore.get(alert.getUserId());
        if (found.isEmpty()) {
            log.warn("No notification preferences for user, alert not sent: alertId={}, userId={}",
                    alert.getId(), alert.getUserId());
            return DeliveryDecision.NO_PREFERENCES;
        }
        NotificationPreferences preferences = found.get();

        if (!preferences.isCategoryEnabled(alert.getType())) {
            alertLifecycleTracker.markSuppressed(alert.getId());
            return DeliveryDecision.SUPPRESSED;
        }

        if (honourQuietHours && alert.getPriority() != AlertPriority.CRITICAL) {
            ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zoneFor(preferences));
            if (quietHoursPolicy.isWithinQuietHours(preferences.getQuietHours(), now.toLocalTime())) {
                return defer(alert, preferences, now);
            }
        }

        if (escalationCascade.shouldEscalate(alert, preferences)) {
            escalationCascade.escalateAsync(alert, preferences);
        }

        DispatchResult result = channelDispatcher.dispatch(alert, preferences);
        alertLifecycleTracker.recordDispatchOutcome(alert.getId(), result);
        return DeliveryDecision.DISPATCHED;
    }

    private DeliveryDecision defer(Alert alert, NotificationPreferences preferences, ZonedDateTime now) {
        ZonedDateTime windowEnd = quietHoursPolicy.nextWindowEnd(preferences.getQuietHours(), now);
        boolean armed = alertLifecycleTracker.armDeferred(
                alert.getId(), windowEnd.toInstant(), DeferralKind.QUIET_HOURS, deferred -> evaluate(deferred, false));

        if (!armed) {
            log.warn("Alert no longer tracked, deferral skipped: alertId={}", alert.getId());
            return DeliveryDecision.SUPPRESSED;
        }
        log.info(
                "Alert deferred until quiet hours end: alertId={}, userId={}, until={}",
                alert.getId(),
                alert.getUserId(),
                windowEnd);
        return DeliveryDecision.DEFERRED;
    }

    private ZoneId zoneFor(NotificationPreferences preferences) {
        String timezone = preferences.getTimezone();
        if (timezone != null && !timezone.isBlank()) {
            try {
                return ZoneId.of(timezone);
            } catch (DateTimeException e) {
                log.warn("Unknown timezone in preferences, using engine zone: userId={}, timezone={}",
                        preferences.getUserId(), timezone);
            }
        }
        return notificationProperties.resolveZone();
    }
}
