package com.crisisalert.api.dto.request;

import com.crisisalert.domain.enums.MoodTrend;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckInRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotNull(message = "moodTrend is required")
    private MoodTrend moodTrend;
}
