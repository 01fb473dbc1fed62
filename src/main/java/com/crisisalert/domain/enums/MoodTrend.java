package com.crisisalert.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Recent mood trajectory driving the wording and priority of a wellness check-in. */
@Getter
@RequiredArgsConstructor
public enum MoodTrend {
    CONCERNING("We noticed you might be going through a tough time. How are you doing today?"),
    STABLE("How are you feeling today? Your wellbeing matters to us."),
    IMPROVING("It looks like things have been going well! How are you feeling today?");

    private final String checkInMessage;
}
