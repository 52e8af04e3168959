package com.example.autoschedule.breaks;

import java.time.LocalDateTime;
import java.util.List;

/**
 * An audit finding. Refers to tasks by id only and is never persisted.
 */
public record BreakViolation(ViolationType type,
                             List<Long> taskIds,
                             LocalDateTime startTime,
                             LocalDateTime endTime,
                             String description,
                             Severity severity,
                             String suggestedFix) {

    public BreakViolation {
        taskIds = List.copyOf(taskIds);
    }

    public boolean involves(Long taskId) {
        return taskIds.contains(taskId);
    }
}
