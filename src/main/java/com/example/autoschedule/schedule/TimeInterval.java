package com.example.autoschedule.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} in the caller's local time zone.
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Interval end must be after start: " + start + " - " + end);
        }
    }

    public static TimeInterval of(LocalDateTime start, long durationMinutes) {
        return new TimeInterval(start, start.plusMinutes(durationMinutes));
    }

    public long durationMinutes() {
        return ChronoUnit.MINUTES.between(start, end);
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    /**
     * Minutes from the end of this interval to the start of {@code next}; negative when they overlap.
     */
    public long gapTo(TimeInterval next) {
        return ChronoUnit.MINUTES.between(end, next.start);
    }

    /**
     * True when at least {@code bufferMinutes} separate the two intervals on whichever side {@code other} lies.
     */
    public boolean isSeparatedFrom(TimeInterval other, long bufferMinutes) {
        return !other.end.plusMinutes(bufferMinutes).isAfter(start)
                || !end.plusMinutes(bufferMinutes).isAfter(other.start);
    }

    public TimeInterval shiftedBy(long minutes) {
        return new TimeInterval(start.plusMinutes(minutes), end.plusMinutes(minutes));
    }

    public boolean endsAfter(LocalDateTime instant) {
        return end.isAfter(instant);
    }

    public LocalDate day() {
        return start.toLocalDate();
    }
}
