package com.example.autoschedule.task;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDateTime;

@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_user", columnList = "user_id"),
        @Index(name = "idx_tasks_user_scheduled_start", columnList = "user_id, scheduled_start")
})
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @NotBlank
    @Column(nullable = false)
    private String title;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.TODO;

    @Enumerated(EnumType.STRING)
    private Priority priority;

    // minutes
    @NotNull
    @Positive
    @Column(name = "duration", nullable = false)
    private Integer duration;

    @Enumerated(EnumType.STRING)
    @Column(name = "energy_level")
    private EnergyLevel energyLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_time")
    private TimePreference preferredTime;

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    @Column(name = "start_date")
    private LocalDateTime startDate;

    @Column(name = "postponed_until")
    private LocalDateTime postponedUntil;

    @Column(name = "is_recurring", nullable = false)
    private boolean recurring;

    @Column(name = "recurrence_rule")
    private String recurrenceRule;

    @Column(name = "is_auto_scheduled", nullable = false)
    private boolean autoScheduled;

    @Column(name = "schedule_locked", nullable = false)
    private boolean scheduleLocked;

    @Column(name = "scheduled_start")
    private LocalDateTime scheduledStart;

    @Column(name = "scheduled_end")
    private LocalDateTime scheduledEnd;

    @Column(name = "schedule_score")
    private Double scheduleScore;

    @Column(name = "last_scheduled")
    private LocalDateTime lastScheduled;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected Task() {
    }

    public Task(String userId, String title, Integer duration) {
        this.userId = userId;
        this.title = title;
        this.duration = duration;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Earliest moment the task may start: the later of start date and postponement.
     */
    public LocalDateTime getNotBefore() {
        if (startDate == null) {
            return postponedUntil;
        }
        if (postponedUntil == null) {
            return startDate;
        }
        return postponedUntil.isAfter(startDate) ? postponedUntil : startDate;
    }

    public void clearSchedule() {
        this.scheduledStart = null;
        this.scheduledEnd = null;
        this.scheduleScore = null;
    }

    public Long getId() { return id; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }
    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public Integer getDuration() { return duration; }
    public void setDuration(Integer duration) { this.duration = duration; }
    public EnergyLevel getEnergyLevel() { return energyLevel; }
    public void setEnergyLevel(EnergyLevel energyLevel) { this.energyLevel = energyLevel; }
    public TimePreference getPreferredTime() { return preferredTime; }
    public void setPreferredTime(TimePreference preferredTime) { this.preferredTime = preferredTime; }
    public LocalDateTime getDueDate() { return dueDate; }
    public void setDueDate(LocalDateTime dueDate) { this.dueDate = dueDate; }
    public LocalDateTime getStartDate() { return startDate; }
    public void setStartDate(LocalDateTime startDate) { this.startDate = startDate; }
    public LocalDateTime getPostponedUntil() { return postponedUntil; }
    public void setPostponedUntil(LocalDateTime postponedUntil) { this.postponedUntil = postponedUntil; }
    public boolean isRecurring() { return recurring; }
    public void setRecurring(boolean recurring) { this.recurring = recurring; }
    public String getRecurrenceRule() { return recurrenceRule; }
    public void setRecurrenceRule(String recurrenceRule) { this.recurrenceRule = recurrenceRule; }
    public boolean isAutoScheduled() { return autoScheduled; }
    public void setAutoScheduled(boolean autoScheduled) { this.autoScheduled = autoScheduled; }
    public boolean isScheduleLocked() { return scheduleLocked; }
    public void setScheduleLocked(boolean scheduleLocked) { this.scheduleLocked = scheduleLocked; }
    public LocalDateTime getScheduledStart() { return scheduledStart; }
    public void setScheduledStart(LocalDateTime scheduledStart) { this.scheduledStart = scheduledStart; }
    public LocalDateTime getScheduledEnd() { return scheduledEnd; }
    public void setScheduledEnd(LocalDateTime scheduledEnd) { this.scheduledEnd = scheduledEnd; }
    public Double getScheduleScore() { return scheduleScore; }
    public void setScheduleScore(Double scheduleScore) { this.scheduleScore = scheduleScore; }
    public LocalDateTime getLastScheduled() { return lastScheduled; }
    public void setLastScheduled(LocalDateTime lastScheduled) { this.lastScheduled = lastScheduled; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
