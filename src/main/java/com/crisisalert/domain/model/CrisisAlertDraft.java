package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertType;
import com.crisisalert.domain.enums.EscalationLevel;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.enums.TriggerSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied fields for a crisis alert. Every non-null field overrides the crisis
 * defaults applied by {@link com.crisisalert.notification.AlertFactory}; id and timestamp
 * are not part of the draft because they are always generated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrisisAlertDraft {

    private String userId;
    private AlertType type;
    private AlertPriority priority;
    private String title;
    private String message;
    private Instant expiresAt;
    private Set<NotificationChannel> channels;
    private List<AlertAction> actions;
    private Map<String, Object> data;
    private Boolean emergency;
    private Boolean requiresAcknowledgment;
    private Integer riskLevel;
    private TriggerSource triggerSource;
    private Boolean interventionRequired;
    private EscalationLevel escalationLevel;
    private GeoLocation location;
}
