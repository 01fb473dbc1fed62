package com.crisisalert.notification;

import com.crisisalert.domain.model.QuietHours;
import com.crisisalert.exception.InvalidPreferencesException;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Quiet-hours arithmetic at minute resolution.
 *
 * <p>A window with {@code start <= end} is the same-day range {@code [start, end]}. With
 * {@code start > end} it wraps midnight and contains every time {@code >= start} or
 * {@code <= end}. Both bounds are inclusive.
 */
@Component
public class QuietHoursPolicy {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public boolean isWithinQuietHours(QuietHours quietHours, LocalTime time) {
        if (quietHours == null || !quietHours.isEnabled()) {
            return false;
        }

        int current = time.getHour() * 60 + time.getMinute();
        int start = toMinutes(quietHours.getStart());
        int end = toMinutes(quietHours.getEnd());

        if (start <= end) {
            return current >= start && current <= end;
        }
        return current >= start || current <= end;
    }

    /**
     * Next occurrence of the window's end at or after {@code now}, compared at minute
     * resolution. Called while inside the window, so the result is never more than a day away.
     */
    public ZonedDateTime nextWindowEnd(QuietHours quietHours, ZonedDateTime now) {
        LocalTime end = parse(quietHours.getEnd());
        ZonedDateTime candidate = now.toLocalDate().atTime(end).atZone(now.getZone());

        if (candidate.isBefore(now.truncatedTo(ChronoUnit.MINUTES))) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    /** Fails fast on malformed HH:mm so bad preferences are rejected when saved. */
    public void validate(QuietHours quietHours) {
        if (quietHours == null) {
            return;
        }
        parse(quietHours.getStart());
        parse(quietHours.getEnd());
    }

    private int toMinutes(String value) {
        LocalTime time = parse(value);
        return time.getHour() * 60 + time.getMinute();
    }

    private LocalTime parse(String value) {
        if (value == null) {
            throw new InvalidPreferencesException("Quiet hours bound is missing");
        }
        try {
            return LocalTime.parse(value.trim(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidPreferencesException(
                    "Quiet hours bound must be HH:mm: " + value, Map.of("value", value));
        }
    }
}
