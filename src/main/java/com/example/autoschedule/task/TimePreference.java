package com.example.autoschedule.task;

import java.time.LocalTime;

/**
 * Part of the day a task prefers. Morning ends at noon, afternoon at 17:00.
 */
public enum TimePreference {
    MORNING,
    AFTERNOON,
    EVENING;

    private static final LocalTime NOON = LocalTime.NOON;
    private static final LocalTime EVENING_START = LocalTime.of(17, 0);

    public static TimePreference of(LocalTime time) {
        if (time.isBefore(NOON)) {
            return MORNING;
        }
        if (time.isBefore(EVENING_START)) {
            return AFTERNOON;
        }
        return EVENING;
    }
}
