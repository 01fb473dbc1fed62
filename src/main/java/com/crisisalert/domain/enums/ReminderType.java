package com.crisisalert.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Wellness reminder categories with their canned title suffix and message. */
@Getter
@RequiredArgsConstructor
public enum ReminderType {
    MOOD_CHECK("Mood Check", "How are you feeling today? Take a moment to check in with yourself."),
    THERAPY("Therapy", "You have a therapy session coming up soon."),
    MEDICATION("Medication", "Reminder to take your medication."),
    JOURNAL(
            "Journal",
            "Consider writing in your journal today - it's a great way to process your thoughts."),
    EXERCISE("Exercise", "A little movement can boost your mood. How about a walk or some stretching?");

    private final String displayName;
    private final String defaultMessage;
}
