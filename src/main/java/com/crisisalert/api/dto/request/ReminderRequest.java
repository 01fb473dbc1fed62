package com.crisisalert.api.dto.request;

import com.crisisalert.domain.enums.ReminderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReminderRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotNull(message = "reminderType is required")
    private ReminderType reminderType;

    /** Replaces the canned message of the reminder type when set. */
    private String customMessage;
}
