package com.example.autoschedule.exception;

/**
 * Raised when a scheduling run cannot start because its input is malformed.
 * A task that merely finds no free slot is not an error and never raises this.
 */
public class ScheduleGenerationException extends BusinessException {

    public static final String INVALID_TASK_DURATION = "INVALID_TASK_DURATION";

    public ScheduleGenerationException(String errorCode, String message, Object... parameters) {
        super(errorCode, message, parameters);
    }

    public static ScheduleGenerationException invalidDuration(Long taskId, int duration) {
        return new ScheduleGenerationException(INVALID_TASK_DURATION,
                "Task " + taskId + " has a non-positive duration: " + duration,
                taskId, duration);
    }
}
