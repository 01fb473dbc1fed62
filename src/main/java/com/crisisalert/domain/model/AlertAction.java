package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.ActionStyle;
import com.crisisalert.domain.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Button attached to an alert.
 *
 * <p>{@code target} depends on the type: a path for URL and CHAT, a phone number for CALL,
 * a duration token such as {@code 1h} or {@code 30m} for SNOOZE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertAction {

    private String id;
    private String label;
    private ActionType type;
    private String target;
    private ActionStyle style;
}
