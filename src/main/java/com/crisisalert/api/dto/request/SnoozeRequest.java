package com.crisisalert.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnoozeRequest {

    /** e.g. {@code 1h} or {@code 30m}. */
    @NotBlank(message = "duration is required")
    private String duration;
}
