package com.crisisalert.api.dto.request;

import com.crisisalert.domain.enums.AlertPriority;
import com.crisisalert.domain.enums.AlertType;
import com.crisisalert.domain.enums.EscalationLevel;
import com.crisisalert.domain.enums.NotificationChannel;
import com.crisisalert.domain.enums.TriggerSource;
import com.crisisalert.domain.model.GeoLocation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/notifications/alerts/crisis}. Only userId is required;
 * omitted fields take the crisis defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrisisAlertRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    /** CRISIS or EMERGENCY. */
    private AlertType type;

    private AlertPriority priority;
    private String title;
    private String message;
    private Set<NotificationChannel> channels;

    @Min(value = 1, message = "riskLevel must be between 1 and 10")
    @Max(value = 10, message = "riskLevel must be between 1 and 10")
    private Integer riskLevel;

    private TriggerSource triggerSource;
    private Boolean interventionRequired;
    private EscalationLevel escalationLevel;
    private Instant expiresAt;
    private GeoLocation location;
    private Map<String, Object> data;
}
