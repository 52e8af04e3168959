package com.example.autoschedule.schedule;

import com.example.autoschedule.task.Task;

import java.time.LocalDateTime;

public record TaskScheduleView(Long id,
                               String title,
                               Integer duration,
                               boolean locked,
                               LocalDateTime scheduledStart,
                               LocalDateTime scheduledEnd,
                               Double scheduleScore,
                               LocalDateTime lastScheduled) {

    public static TaskScheduleView from(Task task) {
        return new TaskScheduleView(task.getId(), task.getTitle(), task.getDuration(), task.isScheduleLocked(),
                task.getScheduledStart(), task.getScheduledEnd(), task.getScheduleScore(), task.getLastScheduled());
    }
}
