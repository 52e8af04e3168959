package com.example.autoschedule.schedule;

import java.util.List;

/**
 * Outcome of one engine run: every input task in input order, plus the ids that found no slot.
 */
public record ScheduleRun(List<PlannedTask> tasks, List<Long> unplacedTaskIds) {

    public ScheduleRun {
        tasks = List.copyOf(tasks);
        unplacedTaskIds = List.copyOf(unplacedTaskIds);
    }

    public long placedCount() {
        return tasks.stream().filter(t -> t.placement().isAutoPlaced()).count();
    }

    public boolean isFullyPlaced() {
        return unplacedTaskIds.isEmpty();
    }
}
