package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.EscalationLevel;
import com.crisisalert.domain.enums.TriggerSource;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Alert tied to detected self-harm or suicide risk.
 *
 * <p>Crisis alerts default to CRITICAL priority, so quiet hours never hold them back,
 * and they start the emergency-contact cascade when the user opted in.
 * {@code contactNotifications} records every contact attempt made by the cascade.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class CrisisAlert extends Alert {

    /** Assessed risk, 1 (low) to 10 (imminent). */
    private int riskLevel;

    private TriggerSource triggerSource;
    private boolean interventionRequired;
    private EscalationLevel escalationLevel;
    private boolean supportTeamNotified;
    private boolean emergencyContactsNotified;
    private GeoLocation location;

    @Builder.Default
    private List<ContactNotification> contactNotifications = new ArrayList<>();

    @Override
    public CrisisAlert snapshot() {
        CrisisAlert copy = (CrisisAlert) super.snapshot();
        copy.setContactNotifications(new ArrayList<>(contactNotifications));
        return copy;
    }
}
