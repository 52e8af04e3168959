package com.example.autoschedule.settings;

import java.time.LocalTime;

/**
 * Hours of the day {@code [startHour, endHour)} a user considers best for one energy level.
 */
public record EnergyWindow(int startHour, int endHour) {

    public boolean contains(LocalTime time) {
        int hour = time.getHour();
        return hour >= startHour && hour < endHour;
    }

    static EnergyWindow ofNullable(Integer startHour, Integer endHour) {
        if (startHour == null || endHour == null) {
            return null;
        }
        return new EnergyWindow(startHour, endHour);
    }
}
