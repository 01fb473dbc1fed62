package com.crisisalert.notification;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.enums.ActionStyle;
import com.crisisalert.domain.enums.ActionType;
import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertType;
import com.crisisalert.domain.enums.EscalationLevel;
import com.crisisalert.domain.enums.MoodTrend;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.enums.ReminderType;
import com.crisisalert.domain.enums.TriggerSource;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.AlertAction;
import com.crisisalert.domain.model.CrisisAlert;
import com.crisisalert.domain.model.CrisisAlertDraft;
import com.crisisalert.exception.InvalidAlertException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds typed alerts with the defaults of their category. Alerts leave the factory
 * PENDING and untracked; registering them is the caller's job.
 *
 * <p>Ids and timestamps are always generated here and cannot be supplied by the caller.
 */
@Component
public class AlertFactory {

    static final int DEFAULT_RISK_LEVEL = 8;
    static final Duration REMINDER_TTL = Duration.ofHours(24);
    static final String REMINDER_SNOOZE_TOKEN = "1h";

    private static final String CRISIS_TITLE = "Crisis Support Available";
    private static final String CRISIS_MESSAGE =
            "You don't have to go through this alone. Immediate support is available right now.";
    private static final String CHECK_IN_TITLE = "Daily Check-in";

    private final Clock clock;
    private final NotificationProperties notificationProperties;

    public AlertFactory(Clock clock, NotificationProperties notificationProperties) {
        this.clock = clock;
        this.notificationProperties = notificationProperties;
    }

    /**
     * Crisis alert with CRITICAL priority, push/SMS/in-app channels and the hotline, chat and
     * safety-plan actions. Every non-null draft field overrides the matching default.
     *
     * @throws InvalidAlertException when the user id is missing or the risk level is outside 1..10
     */
    public CrisisAlert createCrisisAlert(CrisisAlertDraft draft) {
        if (draft == null || draft.getUserId() == null || draft.getUserId().isBlank()) {
            throw new InvalidAlertException("Crisis alert requires a userId");
        }

        int riskLevel = draft.getRiskLevel() != null ? draft.getRiskLevel() : DEFAULT_RISK_LEVEL;
        if (riskLevel < 1 || riskLevel > 10) {
            throw new InvalidAlertException(
                    "Risk level must be between 1 and 10", Map.of("riskLevel", riskLevel));
        }

        return CrisisAlert.builder()
                .id(newId())
                .timestamp(clock.instant())
                .userId(draft.getUserId())
                .type(orDefault(draft.getType(), AlertType.CRISIS))
                .priority(orDefault(draft.getPriority(), AlertPriority.CRITICAL))
                .title(orDefault(draft.getTitle(), CRISIS_TITLE))
                .message(orDefault(draft.getMessage(), CRISIS_MESSAGE))
                .expiresAt(draft.getExpiresAt())
                .channels(channelsOrDefault(
                        draft.getChannels(),
                        EnumSet.of(NotificationChannel.PUSH, NotificationChannel.SMS, NotificationChannel.IN_APP)))
                .actions(draft.getActions() != null ? new ArrayList<>(draft.getActions()) : crisisActions())
                .data(draft.getData() != null ? new HashMap<>(draft.getData()) : new HashMap<>())
                .emergency(orDefault(draft.getEmergency(), Boolean.TRUE))
                .requiresAcknowledgment(orDefault(draft.getRequiresAcknowledgment(), Boolean.TRUE))
                .riskLevel(riskLevel)
                .triggerSource(orDefault(draft.getTriggerSource(), TriggerSource.AI_DETECTION))
                .interventionRequired(orDefault(draft.getInterventionRequired(), Boolean.TRUE))
                .escalationLevel(orDefault(draft.getEscalationLevel(), EscalationLevel.IMMEDIATE))
                .location(draft.getLocation())
                .build();
    }

    /** MEDIUM reminder over push and in-app, expiring after 24 hours. */
    public Alert createReminder(String userId, ReminderType reminderType, String customMessage) {
        requireUser(userId);
        if (reminderType == null) {
            throw new InvalidAlertException("Reminder type is required");
        }

        Instant now = clock.instant();
        String message = customMessage != null && !customMessage.isBlank()
                ? customMessage
                : reminderType.getDefaultMessage();

        List<AlertAction> actions = new ArrayList<>();
        actions.add(action("open-app", "Open App", ActionType.URL, "/", ActionStyle.PRIMARY));
        actions.add(action("snooze", "Remind Later", ActionType.SNOOZE, REMINDER_SNOOZE_TOKEN, ActionStyle.SECONDARY));

        return Alert.builder()
                .id(newId())
                .timestamp(now)
                .userId(userId)
                .type(AlertType.REMINDER)
                .priority(AlertPriority.MEDIUM)
                .title("Wellness Reminder - " + reminderType.getDisplayName())
                .message(message)
                .expiresAt(now.plus(REMINDER_TTL))
                .channels(EnumSet.of(NotificationChannel.PUSH, NotificationChannel.IN_APP))
                .actions(actions)
                .build();
    }

    /** HIGH priority and an extra crisis-support action when the trend is concerning, MEDIUM otherwise. */
    public Alert createWellnessCheckIn(String userId, MoodTrend moodTrend) {
        requireUser(userId);
        if (moodTrend == null) {
            throw new InvalidAlertException("Mood trend is required");
        }

        boolean concerning = moodTrend == MoodTrend.CONCERNING;

        List<AlertAction> actions = new ArrayList<>();
        actions.add(action("mood-tracking", "Track Mood", ActionType.URL, "/mood-gamified", ActionStyle.PRIMARY));
        actions.add(action("ai-therapy", "Talk to AI Therapist", ActionType.URL, "/ai-therapy", ActionStyle.SECONDARY));
        if (concerning) {
            actions.add(action("crisis-support", "Get Crisis Support", ActionType.URL, "/crisis", ActionStyle.DANGER));
        }

        return Alert.builder()
                .id(newId())
                .timestamp(clock.instant())
                .userId(userId)
                .type(AlertType.CHECK_IN)
                .priority(concerning ? AlertPriority.HIGH : AlertPriority.MEDIUM)
                .title(CHECK_IN_TITLE)
                .message(moodTrend.getCheckInMessage())
                .channels(EnumSet.of(NotificationChannel.PUSH, NotificationChannel.IN_APP))
                .actions(actions)
                .build();
    }

    private List<AlertAction> crisisActions() {
        String hotline = notificationProperties.getCrisisHotline();
        List<AlertAction> actions = new ArrayList<>();
        actions.add(action(
                "call-" + hotline, "Call " + hotline + " Crisis Line", ActionType.CALL, hotline, ActionStyle.DANGER));
        actions.add(action("crisis-chat", "Start Crisis Chat", ActionType.CHAT, "/crisis/chat", ActionStyle.PRIMARY));
        actions.add(action(
                "safety-plan", "View Safety Plan", ActionType.URL, "/crisis/safety-plan", ActionStyle.SECONDARY));
        return actions;
    }

    private static AlertAction action(String id, String label, ActionType type, String target, ActionStyle style) {
        return AlertAction.builder()
                .id(id)
                .label(label)
                .type(type)
                .target(target)
                .style(style)
                .build();
    }

    private static EnumSet<NotificationChannel> channelsOrDefault(
            Set<NotificationChannel> requested, EnumSet<NotificationChannel> defaults) {
        if (requested == null) {
            return defaults;
        }
        return requested.isEmpty() ? EnumSet.noneOf(NotificationChannel.class) : EnumSet.copyOf(requested);
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidAlertException("userId is required");
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
