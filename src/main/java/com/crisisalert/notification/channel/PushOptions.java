package com.crisisalert.notification.channel;

import com.crisisalert.domain.model.AlertAction;
import java.util.List;

/**
 * Rendering hints passed with a push notification.
 *
 * @param tag                collapse key; the alert id, so a re-delivery replaces the earlier notification
 * @param requireInteraction keep the notification on screen until the user acts
 * @param vibrationPattern   milliseconds on/off; a longer pattern for critical alerts
 * @param actions            buttons offered on the notification
 */
public record PushOptions(String tag, boolean requireInteraction, List<Integer> vibrationPattern, List<AlertAction> actions) {}
