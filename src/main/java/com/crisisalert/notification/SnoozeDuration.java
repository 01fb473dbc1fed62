package com.crisisalert.notification;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses snooze tokens of the form {@code <N>h} or {@code <N>m}, e.g. {@code 1h}, {@code 30m}. */
public final class SnoozeDuration {

    private static final Pattern TOKEN = Pattern.compile("^(\\d+)([hm])$");

    /** Longest snooze accepted. Anything longer is treated as malformed. */
    public static final Duration MAX = Duration.ofDays(365);

    private SnoozeDuration() {}

    /** @return empty for null, blank, zero, malformed or over-long tokens */
    public static Optional<Duration> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }

        Matcher matcher = TOKEN.matcher(token.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        try {
            long amount = Long.parseLong(matcher.group(1));
            if (amount == 0) {
                return Optional.empty();
            }
            Duration duration = "h".equals(matcher.group(2)) ? Duration.ofHours(amount) : Duration.ofMinutes(amount);
            return duration.compareTo(MAX) > 0 ? Optional.empty() : Optional.of(duration);
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }
}
