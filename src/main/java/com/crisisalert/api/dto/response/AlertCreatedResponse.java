package com.crisisalert.api.dto.response;

import com.crisisalert.domain.enums.AlertStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Returned when an alert is submitted: its id and status right after the delivery decision. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertCreatedResponse {

    private String alertId;
    private AlertStatus status;
}
