package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.AlertType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-user delivery preferences: channel toggles, per-category toggles, quiet hours,
 * contact details and the ranked emergency-contact list.
 *
 * <p>Saving preferences replaces the previous record entirely; there is no partial merge.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {

    @NotBlank
    private String userId;

    /** Name used in messages to emergency contacts. */
    private String displayName;

    private boolean pushNotifications;
    private boolean smsNotifications;
    private boolean emailNotifications;

    private boolean crisisAlerts;
    private boolean reminderAlerts;
    private boolean moodCheckIns;
    private boolean therapyReminders;
    private boolean supportGroupNotifications;
    private boolean emergencyContactAlerts;

    @Valid
    private QuietHours quietHours;

    private String phoneNumber;
    private String email;

    /** IANA zone id for quiet-hours evaluation. Falls back to the engine's zone when blank. */
    private String timezone;

    @Valid
    @Builder.Default
    private List<EmergencyContact> emergencyContacts = new ArrayList<>();

    public boolean isCategoryEnabled(AlertType type) {
        return switch (type) {
            case CRISIS, EMERGENCY -> crisisAlerts;
            case REMINDER -> reminderAlerts;
            case CHECK_IN -> moodCheckIns;
            case THERAPY -> therapyReminders;
            case SUPPORT -> supportGroupNotifications;
        };
    }
}
