package com.example.autoschedule.schedule;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Source of calendar commitments the engine must avoid.
 * Implementations return already-expanded intervals (recurrences resolved) in the scheduler's time zone.
 */
@FunctionalInterface
public interface BusyIntervalProvider {

    List<TimeInterval> findBusyIntervals(String userId, LocalDateTime from, LocalDateTime to);
}
