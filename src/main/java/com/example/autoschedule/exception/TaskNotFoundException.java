package com.example.autoschedule.exception;

import java.util.Collection;
import java.util.List;

public class TaskNotFoundException extends BusinessException {

    private final List<Long> missingIds;

    public TaskNotFoundException(String userId, Collection<Long> missingIds) {
        super("TASK_NOT_FOUND", "Tasks not found for user " + userId + ": " + missingIds, userId);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<Long> getMissingIds() {
        return missingIds;
    }
}
