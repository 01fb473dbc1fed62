package com.crisisalert.notification;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.ContactNotification;
import com.crisisalert.domain.model.CrisisAlert;
import com.crisisalert.domain.model.EmergencyContact;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.event.AlertEventPublisher;
import com.crisisalert.notification.channel.EmailSink;
import com.crisisalert.notification.channel.SmsSink;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Notifies a user's emergency contacts about a crisis alert, independently of the
 * user-facing dispatch.
 *
 * <p>Only crisis and emergency alerts escalate, and only when the user enabled
 * {@code emergencyContactAlerts}. The first {@code max-emergency-contacts} contacts by ascending
 * priority each get an SMS (if they have a phone) and an email (if they have an address),
 * carrying the templated contact message rather than the alert text. Failed attempts are
 * recorded on the alert and not retried; the alert is flagged as escalated either way.
 */
@Component
public class EscalationCascade {

    private static final Logger log = LoggerFactory.getLogger(EscalationCascade.class);

    /** Data key flagging escalation on alerts that are not {@link CrisisAlert}s. */
    static final String CONTACTS_NOTIFIED_KEY = "emergencyContactsNotified";

    private final SmsSink smsSink;
    private final EmailSink emailSink;
    private final ContactMessageTemplates contactMessageTemplates;
    private final AlertLifecycleTracker alertLifecycleTracker;
    private final AlertEventPublisher alertEventPublisher;
    private final Executor notificationExecutor;
    private final NotificationProperties notificationProperties;

    public EscalationCascade(
            SmsSink smsSink,
            EmailSink emailSink,
            ContactMessageTemplates contactMessageTemplates,
            AlertLifecycleTracker alertLifecycleTracker,
            AlertEventPublisher alertEventPublisher,
            @Qualifier("notificationExecutor") Executor notificationExecutor,
            NotificationProperties notificationProperties) {
        this.smsSink = smsSink;
        this.emailSink = emailSink;
        this.contactMessageTemplates = contactMessageTemplates;
        this.alertLifecycleTracker = alertLifecycleTracker;
        this.alertEventPublisher = alertEventPublisher;
        this.notificationExecutor = notificationExecutor;
        this.notificationProperties = notificationProperties;
    }

    /** False for non-crisis alerts, when the user opted out, or when the alert already escalated. */
    public boolean shouldEscalate(Alert alert, NotificationPreferences preferences) {
        return alert.getType().isCrisis()
                && preferences.isEmergencyContactAlerts()
                && !alreadyEscalated(alert);
    }

    /**
     * Runs {@link #escalate} on the notification executor. When the executor refuses the
     * task the cascade runs on the calling thread, so contacts are never skipped.
     */
    public CompletableFuture<List<ContactNotification>> escalateAsync(Alert alert, NotificationPreferences preferences) {
        CompletableFuture<List<ContactNotification>> cascade;
        try {
            cascade = CompletableFuture.supplyAsync(() -> escalate(alert, preferences), notificationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Notification executor saturated, escalating inline: alertId={}", alert.getId());
            cascade = CompletableFuture.completedFuture(escalate(alert, preferences));
        }
        return cascade.exceptionally(ex -> {
            log.error("Escalation aborted: alertId={}, error={}", alert.getId(), ex.getMessage(), ex);
            return List.of();
        });
    }

    /**
     * Contacts the selected emergency contacts in priority order.
     *
     * @return every attempt made, successful or not
     */
    public List<ContactNotification> escalate(Alert alert, NotificationPreferences preferences) {
        List<EmergencyContact> contacts = selectContacts(preferences);
        String subject = contactMessageTemplates.contactSubject();
        String body = contactMessageTemplates.contactBody(preferences);
        String sms = contactMessageTemplates.contactSms(preferences);

        List<ContactNotification> attempts = new ArrayList<>();
        for (EmergencyContact contact : contacts) {
            if (hasText(contact.getPhone())) {
                attempts.add(attempt(contact, NotificationChannel.SMS, () -> smsSink.send(contact.getPhone(), sms)));
            }
            if (hasText(contact.getEmail())) {
                attempts.add(attempt(
                        contact,
                        NotificationChannel.EMAIL,
                        () -> emailSink.send(contact.getEmail(), subject, body, List.of())));
            }
        }

        long failed = attempts.stream().filter(a -> !a.isSuccess()).count();
        alertLifecycleTracker.markEmergencyContactsNotified(alert.getId(), attempts);
        alertEventPublisher.publishEscalationCompleted(this, alert.getId(), contacts.size(), (int) failed);

        log.info(
                "Emergency contacts notified: alertId={}, contacts={}, attempts={}, failed={}",
                alert.getId(),
                contacts.size(),
                attempts.size(),
                failed);
        return attempts;
    }

    /** Lowest priority values first, capped at {@code max-emergency-contacts}. */
    public List<EmergencyContact> selectContacts(NotificationPreferences preferences) {
        if (preferences.getEmergencyContacts() == null) {
            return List.of();
        }
        return preferences.getEmergencyContacts().stream()
                .sorted(Comparator.comparingInt(EmergencyContact::getPriority))
                .limit(notificationProperties.getMaxEmergencyContacts())
                .toList();
    }

    private ContactNotification attempt(EmergencyContact contact, NotificationChannel channel, BooleanSupplier send) {
        ContactNotification.ContactNotificationBuilder result = ContactNotification.builder()
                .contactName(contact.getName())
                .contactPriority(contact.getPriority())
                .channel(channel);
        try {
            boolean accepted = send.getAsBoolean();
            if (!accepted) {
                log.warn("Emergency contact {} rejected: contact={}", channel, contact.getName());
                return result.success(false).error("Sink rejected the message").build();
            }
            return result.success(true).build();
        } catch (Exception e) {
            log.error("Emergency contact {} failed: contact={}, error={}", channel, contact.getName(), e.getMessage());
            return result.success(false).error(e.getMessage()).build();
        }
    }

    private static boolean alreadyEscalated(Alert alert) {
        if (alert instanceof CrisisAlert crisisAlert) {
            return crisisAlert.isEmergencyContactsNotified();
        }
        return Boolean.TRUE.equals(alert.getData().get(CONTACTS_NOTIFIED_KEY));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
