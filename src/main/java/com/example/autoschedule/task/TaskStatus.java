package com.example.autoschedule.task;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    TODO,
    IN_PROGRESS,
    COMPLETED;

    /** Statuses that keep a task out of automatic placement. */
    public static final Set<TaskStatus> NOT_SCHEDULABLE = EnumSet.of(IN_PROGRESS, COMPLETED);
}
