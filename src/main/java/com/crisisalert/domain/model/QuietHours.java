package com.crisisalert.domain.model;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Daily window, in the user's local time, during which non-critical alerts are held back.
 * {@code start} after {@code end} means the window wraps midnight (e.g. 22:00 to 07:00).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuietHours {

    private static final String TIME_PATTERN = "^([01]?\\d|2[0-3]):[0-5]\\d$";

    /** HH:mm */
    @Pattern(regexp = TIME_PATTERN)
    private String start;

    /** HH:mm */
    @Pattern(regexp = TIME_PATTERN)
    private String end;

    private boolean enabled;
}
