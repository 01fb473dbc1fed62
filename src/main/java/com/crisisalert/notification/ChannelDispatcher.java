package com.crisisalert.notification;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.ChannelOutcomeType;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.ChannelOutcome;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.event.AlertEventPublisher;
import com.crisisalert.exception.ChannelUnavailableException;
import com.crisisalert.notification.channel.EmailSink;
import com.crisisalert.notification.channel.InAppSink;
import com.crisisalert.notification.channel.PushOptions;
import com.crisisalert.notification.channel.PushSink;
import com.crisisalert.notification.channel.SmsSink;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans an alert out to its channel sinks.
 *
 * <p>A channel is invoked when the alert requests it and the user enabled it. Each external
 * channel (push, SMS, email) runs as its own future on the notification executor, bounded by
 * {@code crisisalert.notifications.channel-timeout}; a slow or failing channel never holds up
 * the others. In-app runs synchronously on the calling thread while the external calls are in
 * flight, and is attempted for every emergency alert even when it was not requested, so a
 * crisis alert is visible in the app when every external provider is down.
 *
 * <p>Sink exceptions are classified, never rethrown:
 * <ul>
 *   <li>{@link ChannelUnavailableException}, or the executor refusing the call: UNAVAILABLE</li>
 *   <li>timeout: TIMED_OUT</li>
 *   <li>anything else, or a sink returning false: FAILED</li>
 * </ul>
 */
@Component
public class ChannelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChannelDispatcher.class);

    private static final List<Integer> CRITICAL_VIBRATION = List.of(200, 100, 200, 100, 200);
    private static final List<Integer> DEFAULT_VIBRATION = List.of(200);

    private final PushSink pushSink;
    private final SmsSink smsSink;
    private final EmailSink emailSink;
    private final InAppSink inAppSink;
    private final ContactMessageTemplates contactMessageTemplates;
    private final AlertEventPublisher alertEventPublisher;
    private final Executor notificationExecutor;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    public ChannelDispatcher(
            PushSink pushSink,
            SmsSink smsSink,
            EmailSink emailSink,
            InAppSink inAppSink,
            ContactMessageTemplates contactMessageTemplates,
            AlertEventPublisher alertEventPublisher,
            @Qualifier("notificationExecutor") Executor notificationExecutor,
            NotificationProperties notificationProperties,
            Clock clock) {
        this.pushSink = pushSink;
        this.smsSink = smsSink;
        this.emailSink = emailSink;
        this.inAppSink = inAppSink;
        this.contactMessageTemplates = contactMessageTemplates;
        this.alertEventPublisher = alertEventPublisher;
        this.notificationExecutor = notificationExecutor;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    /** Waits for every invoked channel and returns their outcomes. Never throws for a channel failure. */
    public DispatchResult dispatch(Alert alert, NotificationPreferences preferences) {
        Duration timeout = notificationProperties.getChannelTimeout();
        Map<NotificationChannel, CompletableFuture<ChannelOutcome>> inFlight = new EnumMap<>(NotificationChannel.class);

        for (NotificationChannel channel : alert.getChannels()) {
            if (channel.isExternal() && isEnabled(channel, preferences)) {
                inFlight.put(channel, submit(channel, alert, preferences, timeout));
            }
        }

        Map<NotificationChannel, ChannelOutcome> outcomes = new EnumMap<>(NotificationChannel.class);

        if (alert.getChannels().contains(NotificationChannel.IN_APP) || alert.isEmergency()) {
            outcomes.put(NotificationChannel.IN_APP, publishInApp(alert));
        }

        inFlight.forEach((channel, future) -> outcomes.put(channel, await(channel, future)));

        outcomes.values().stream()
                .filter(outcome -> !outcome.isSuccess())
                .forEach(outcome -> {
                    log.error(
                            "Channel delivery failed: alertId={}, channel={}, outcome={}, error={}",
                            alert.getId(),
                            outcome.getChannel(),
                            outcome.getType(),
                            outcome.getError());
                    alertEventPublisher.publishChannelFailure(this, alert.getId(), outcome);
                });

        DispatchResult result = new DispatchResult(outcomes);
        log.info(
                "Alert dispatched: alertId={}, channels={}, status={}",
                alert.getId(),
                outcomes.keySet(),
                result.resultingStatus());
        return result;
    }

    /** Whether the user's preferences allow the channel at all. IN_APP cannot be turned off. */
    public boolean isEnabled(NotificationChannel channel, NotificationPreferences preferences) {
        return switch (channel) {
            case PUSH -> preferences.isPushNotifications();
            case SMS -> preferences.isSmsNotifications();
            case EMAIL -> preferences.isEmailNotifications();
            case IN_APP -> true;
        };
    }

    private CompletableFuture<ChannelOutcome> submit(
            NotificationChannel channel, Alert alert, NotificationPreferences preferences, Duration timeout) {
        try {
            return CompletableFuture.supplyAsync(() -> send(channel, alert, preferences), notificationExecutor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> classify(channel, ex));
        } catch (RejectedExecutionException e) {
            log.warn("Notification executor saturated, channel skipped: alertId={}, channel={}", alert.getId(), channel);
            return CompletableFuture.completedFuture(ChannelOutcome.failure(
                    channel, ChannelOutcomeType.UNAVAILABLE, "Notification executor saturated", clock.instant()));
        }
    }

    private ChannelOutcome send(NotificationChannel channel, Alert alert, NotificationPreferences preferences) {
        boolean accepted = switch (channel) {
            case PUSH -> pushSink.send(alert.getUserId(), alert.getTitle(), alert.getMessage(), pushOptions(alert));
            case SMS -> smsSink.send(
                    requireAddress(channel, preferences.getPhoneNumber()), contactMessageTemplates.userSms(alert));
            case EMAIL -> emailSink.send(
                    requireAddress(channel, preferences.getEmail()),
                    alert.getTitle(),
                    alert.getMessage(),
                    alert.getActions());
            case IN_APP -> throw new IllegalArgumentException("IN_APP is published synchronously");
        };

        if (!accepted) {
            return ChannelOutcome.failure(channel, ChannelOutcomeType.FAILED, "Sink rejected the message", clock.instant());
        }
        log.debug("Channel delivered: alertId={}, channel={}", alert.getId(), channel);
        return ChannelOutcome.success(channel, clock.instant());
    }

    private ChannelOutcome publishInApp(Alert alert) {
        try {
            inAppSink.publish(alert);
            log.debug("Channel delivered: alertId={}, channel={}", alert.getId(), NotificationChannel.IN_APP);
            return ChannelOutcome.success(NotificationChannel.IN_APP, clock.instant());
        } catch (Exception e) {
            return classify(NotificationChannel.IN_APP, e);
        }
    }

    private ChannelOutcome await(NotificationChannel channel, CompletableFuture<ChannelOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChannelOutcome.failure(channel, ChannelOutcomeType.FAILED, "Interrupted", clock.instant());
        } catch (ExecutionException e) {
            return classify(channel, e.getCause());
        }
    }

    private ChannelOutcome classify(NotificationChannel channel, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof ChannelUnavailableException) {
            return ChannelOutcome.failure(channel, ChannelOutcomeType.UNAVAILABLE, cause.getMessage(), clock.instant());
        }
        if (cause instanceof TimeoutException) {
            return ChannelOutcome.failure(
                    channel,
                    ChannelOutcomeType.TIMED_OUT,
                    "No answer within " + notificationProperties.getChannelTimeout(),
                    clock.instant());
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return ChannelOutcome.failure(channel, ChannelOutcomeType.FAILED, message, clock.instant());
    }

    private static PushOptions pushOptions(Alert alert) {
        return new PushOptions(
                alert.getId(),
                alert.isRequiresAcknowledgment(),
                alert.getPriority() == AlertPriority.CRITICAL ? CRITICAL_VIBRATION : DEFAULT_VIBRATION,
                alert.getActions());
    }

    private static String requireAddress(NotificationChannel channel, String address) {
        if (address == null || address.isBlank()) {
            throw new ChannelUnavailableException(channel, "No " + channel.name().toLowerCase() + " address on file");
        }
        return address;
    }
}
