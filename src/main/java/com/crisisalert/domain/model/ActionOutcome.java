package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.ActionOutcomeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Instruction returned to the UI after an alert action click. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionOutcome {

    private String alertId;
    private ActionOutcomeType type;

    /** Navigation path or {@code tel:} URI, set for NAVIGATE and DIAL. */
    private String target;

    public static ActionOutcome ignored(String alertId) {
        return new ActionOutcome(alertId, ActionOutcomeType.IGNORED, null);
    }
}
