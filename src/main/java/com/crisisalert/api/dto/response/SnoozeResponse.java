package com.crisisalert.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** {@code snoozed} is false when the duration token could not be parsed; the alert is then unchanged. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnoozeResponse {

    private String alertId;
    private boolean snoozed;
}
