package com.example.autoschedule.settings;

import com.example.autoschedule.exception.ConstraintViolationException;
import com.example.autoschedule.task.EnergyLevel;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved, immutable scheduling configuration of one user.
 * <p>
 * This is the only form in which settings reach the engine and the break services;
 * every invariant is checked on construction so the algorithms never see a broken policy.
 */
public record SchedulingPolicy(Set<DayOfWeek> workDays,
                               int workHourStart,
                               int workHourEnd,
                               int bufferMinutes,
                               int maxConsecutiveHours,
                               int minBreakDuration,
                               boolean enforceBreaks,
                               Map<EnergyLevel, EnergyWindow> energyWindows) {

    public static final Set<DayOfWeek> WEEKDAYS = Collections.unmodifiableSet(
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));

    public SchedulingPolicy {
        if (workDays == null || workDays.isEmpty()) {
            throw new ConstraintViolationException("At least one work day is required", "workDays", workDays);
        }
        if (workHourStart < 0 || workHourEnd > 24) {
            throw new ConstraintViolationException(
                    "Work hours must lie within 0..24: " + workHourStart + "-" + workHourEnd,
                    "workHours", workHourStart + "-" + workHourEnd);
        }
        if (workHourStart >= workHourEnd) {
            throw new ConstraintViolationException(
                    "workHourStart must be before workHourEnd: " + workHourStart + " >= " + workHourEnd,
                    "workHours", workHourStart + "-" + workHourEnd);
        }
        if (bufferMinutes < 0) {
            throw new ConstraintViolationException("bufferMinutes must not be negative", "bufferMinutes", bufferMinutes);
        }
        if (maxConsecutiveHours <= 0) {
            throw new ConstraintViolationException("maxConsecutiveHours must be positive",
                    "maxConsecutiveHours", maxConsecutiveHours);
        }
        if (minBreakDuration < 0) {
            throw new ConstraintViolationException("minBreakDuration must not be negative",
                    "minBreakDuration", minBreakDuration);
        }
        Map<EnergyLevel, EnergyWindow> windows = new EnumMap<>(EnergyLevel.class);
        if (energyWindows != null) {
            energyWindows.forEach((level, window) -> {
                if (level == null || window == null) {
                    return;
                }
                if (window.startHour() < 0 || window.endHour() > 24 || window.startHour() >= window.endHour()) {
                    throw new ConstraintViolationException("Invalid " + level + " energy window",
                            "energyWindow", window.startHour() + "-" + window.endHour());
                }
                windows.put(level, window);
            });
        }
        workDays = Collections.unmodifiableSet(EnumSet.copyOf(workDays));
        energyWindows = Collections.unmodifiableMap(windows);
    }

    public static SchedulingPolicy defaults() {
        return new SchedulingPolicy(WEEKDAYS, 9, 17, 15, 3, 10, true, Map.of());
    }

    public SchedulingPolicy withWorkDays(Set<DayOfWeek> days) {
        return new SchedulingPolicy(days, workHourStart, workHourEnd, bufferMinutes,
                maxConsecutiveHours, minBreakDuration, enforceBreaks, energyWindows);
    }

    public SchedulingPolicy withWorkHours(int start, int end) {
        return new SchedulingPolicy(workDays, start, end, bufferMinutes,
                maxConsecutiveHours, minBreakDuration, enforceBreaks, energyWindows);
    }

    public SchedulingPolicy withBufferMinutes(int buffer) {
        return new SchedulingPolicy(workDays, workHourStart, workHourEnd, buffer,
                maxConsecutiveHours, minBreakDuration, enforceBreaks, energyWindows);
    }

    public SchedulingPolicy withBreaks(int maxHours, int minBreak, boolean enforce) {
        return new SchedulingPolicy(workDays, workHourStart, workHourEnd, bufferMinutes,
                maxHours, minBreak, enforce, energyWindows);
    }

    public SchedulingPolicy withEnergyWindow(EnergyLevel level, EnergyWindow window) {
        Map<EnergyLevel, EnergyWindow> windows = new EnumMap<>(EnergyLevel.class);
        windows.putAll(energyWindows);
        windows.put(level, window);
        return new SchedulingPolicy(workDays, workHourStart, workHourEnd, bufferMinutes,
                maxConsecutiveHours, minBreakDuration, enforceBreaks, windows);
    }

    public boolean isWorkDay(LocalDate date) {
        return workDays.contains(date.getDayOfWeek());
    }

    public LocalDateTime workDayStart(LocalDate date) {
        return date.atStartOfDay().plusHours(workHourStart);
    }

    public LocalDateTime workDayEnd(LocalDate date) {
        return date.atStartOfDay().plusHours(workHourEnd);
    }

    public int workSpanMinutes() {
        return (workHourEnd - workHourStart) * 60;
    }

    public int maxConsecutiveMinutes() {
        return maxConsecutiveHours * 60;
    }

    public Optional<EnergyWindow> energyWindow(EnergyLevel level) {
        return level == null ? Optional.empty() : Optional.ofNullable(energyWindows.get(level));
    }
}
