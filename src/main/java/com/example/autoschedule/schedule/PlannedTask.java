package com.example.autoschedule.schedule;

import com.example.autoschedule.task.EnergyLevel;
import com.example.autoschedule.task.Priority;
import com.example.autoschedule.task.TimePreference;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable view of a task as the scheduling core sees it.
 * <p>
 * Placement changes go through {@link #place}, {@link #unschedule} and {@link #shiftedBy},
 * all of which refuse to touch a {@link Placement.Kind#LOCKED locked} placement.
 */
public record PlannedTask(Long id,
                          int durationMinutes,
                          Priority priority,
                          EnergyLevel energyLevel,
                          TimePreference preferredTime,
                          LocalDateTime dueDate,
                          LocalDateTime notBefore,
                          Placement placement,
                          LocalDateTime lastScheduled) {

    public PlannedTask {
        Objects.requireNonNull(id, "id");
        placement = placement == null ? Placement.unscheduled() : placement;
    }

    public static Builder builder(long id, int durationMinutes) {
        return new Builder(id, durationMinutes);
    }

    public boolean isScheduled() {
        return placement.isScheduled();
    }

    public boolean isLocked() {
        return placement.isLocked();
    }

    /** The placed interval, or {@code null} when unscheduled. */
    public TimeInterval interval() {
        return placement.interval();
    }

    public LocalDateTime scheduledStart() {
        return placement.isScheduled() ? placement.interval().start() : null;
    }

    public LocalDateTime scheduledEnd() {
        return placement.isScheduled() ? placement.interval().end() : null;
    }

    public Double scheduleScore() {
        return placement.score();
    }

    public PlannedTask place(TimeInterval interval, double score, LocalDateTime scheduledAt) {
        requireMovable("place");
        return new PlannedTask(id, durationMinutes, priority, energyLevel, preferredTime, dueDate, notBefore,
                Placement.autoPlaced(interval, score), scheduledAt);
    }

    public PlannedTask unschedule() {
        requireMovable("unschedule");
        return new PlannedTask(id, durationMinutes, priority, energyLevel, preferredTime, dueDate, notBefore,
                Placement.unscheduled(), lastScheduled);
    }

    public PlannedTask shiftedBy(long minutes) {
        requireMovable("shift");
        if (!placement.isAutoPlaced()) {
            throw new IllegalStateException("Task " + id + " has no placement to shift");
        }
        return new PlannedTask(id, durationMinutes, priority, energyLevel, preferredTime, dueDate, notBefore,
                Placement.autoPlaced(placement.interval().shiftedBy(minutes), placement.score()), lastScheduled);
    }

    private void requireMovable(String action) {
        if (placement.isLocked()) {
            throw new IllegalStateException("Cannot " + action + " locked task " + id);
        }
    }

    public static final class Builder {
        private final long id;
        private final int durationMinutes;
        private Priority priority;
        private EnergyLevel energyLevel;
        private TimePreference preferredTime;
        private LocalDateTime dueDate;
        private LocalDateTime notBefore;
        private Placement placement = Placement.unscheduled();
        private LocalDateTime lastScheduled;

        private Builder(long id, int durationMinutes) {
            this.id = id;
            this.durationMinutes = durationMinutes;
        }

        public Builder priority(Priority priority) { this.priority = priority; return this; }
        public Builder energyLevel(EnergyLevel energyLevel) { this.energyLevel = energyLevel; return this; }
        public Builder preferredTime(TimePreference preferredTime) { this.preferredTime = preferredTime; return this; }
        public Builder dueDate(LocalDateTime dueDate) { this.dueDate = dueDate; return this; }
        public Builder notBefore(LocalDateTime notBefore) { this.notBefore = notBefore; return this; }
        public Builder placement(Placement placement) { this.placement = placement; return this; }
        public Builder lastScheduled(LocalDateTime lastScheduled) { this.lastScheduled = lastScheduled; return this; }

        public Builder scheduledAt(LocalDateTime start) {
            this.placement = Placement.autoPlaced(TimeInterval.of(start, durationMinutes), 0);
            return this;
        }

        public Builder lockedAt(LocalDateTime start) {
            this.placement = Placement.locked(TimeInterval.of(start, durationMinutes));
            return this;
        }

        public PlannedTask build() {
            return new PlannedTask(id, durationMinutes, priority, energyLevel, preferredTime, dueDate, notBefore,
                    placement, lastScheduled);
        }
    }
}
