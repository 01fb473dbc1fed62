package com.crisisalert.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.crisisalert.notification.SnoozeDuration;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SnoozeDuration.
 *
 * <p>Verifies: hour and minute tokens, malformed input, and zero or
 * over-long durations.
 */
class SnoozeDurationTest {

    @Test
    void hoursAndMinutes_parsed() {
        assertThat(SnoozeDuration.parse("1h")).contains(Duration.ofHours(1));
        assertThat(SnoozeDuration.parse("30m")).contains(Duration.ofMinutes(30));
        assertThat(SnoozeDuration.parse(" 2h ")).contains(Duration.ofHours(2));
    }

    @Test
    void malformedTokens_empty() {
        assertThat(SnoozeDuration.parse("soon")).isEmpty();
        assertThat(SnoozeDuration.parse("1d")).isEmpty();
        assertThat(SnoozeDuration.parse("h1")).isEmpty();
        assertThat(SnoozeDuration.parse("1.5h")).isEmpty();
        assertThat(SnoozeDuration.parse("")).isEmpty();
        assertThat(SnoozeDuration.parse(null)).isEmpty();
    }

    @Test
    void zeroOrOverflowingAmount_empty() {
        assertThat(SnoozeDuration.parse("0m")).isEmpty();
        assertThat(SnoozeDuration.parse("99999999999999999999h")).isEmpty();
        assertThat(SnoozeDuration.parse("9000000000000h")).isEmpty();
    }

    @Test
    void longerThanOneYear_empty() {
        assertThat(SnoozeDuration.parse("8760h")).contains(SnoozeDuration.MAX);
        assertThat(SnoozeDuration.parse("8761h")).isEmpty();
        assertThat(SnoozeDuration.parse("525601m")).isEmpty();
    }
}
