package com.example.autoschedule.schedule;

import com.example.autoschedule.task.Task;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts stored tasks to the scheduling core's {@link PlannedTask} and writes results back.
 */
@Component
public class TaskPlanMapper {

    public PlannedTask toPlan(Task task) {
        return new PlannedTask(
                task.getId(),
                task.getDuration() == null ? 0 : task.getDuration(),
                task.getPriority(),
                task.getEnergyLevel(),
                task.getPreferredTime(),
                task.getDueDate(),
                task.getNotBefore(),
                placementOf(task),
                task.getLastScheduled());
    }

    public List<PlannedTask> toPlans(List<Task> tasks) {
        return tasks.stream().map(this::toPlan).toList();
    }

    /**
     * Copies the placement of {@code plan} onto {@code task}. Locked tasks are never written.
     */
    public void apply(PlannedTask plan, Task task) {
        if (task.isScheduleLocked() || plan.isLocked()) {
            return;
        }
        task.setScheduledStart(plan.scheduledStart());
        task.setScheduledEnd(plan.scheduledEnd());
        task.setScheduleScore(plan.scheduleScore());
        task.setLastScheduled(plan.lastScheduled());
    }

    private Placement placementOf(Task task) {
        if (task.getScheduledStart() == null || task.getScheduledEnd() == null
                || !task.getScheduledEnd().isAfter(task.getScheduledStart())) {
            return Placement.unscheduled();
        }
        TimeInterval interval = new TimeInterval(task.getScheduledStart(), task.getScheduledEnd());
        if (task.isScheduleLocked()) {
            return Placement.locked(interval);
        }
        return Placement.autoPlaced(interval, task.getScheduleScore() == null ? 0.0 : task.getScheduleScore());
    }
}
