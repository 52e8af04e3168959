package com.example.autoschedule.settings;

import com.example.autoschedule.task.EnergyLevel;
import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Entity
@Table(name = "auto_schedule_settings")
public class AutoScheduleSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private String userId;

    @Convert(converter = WorkDaysConverter.class)
    @Column(name = "work_days", nullable = false)
    private Set<DayOfWeek> workDays = EnumSet.copyOf(SchedulingPolicy.WEEKDAYS);

    @Column(name = "work_hour_start", nullable = false)
    private Integer workHourStart = 9;

    @Column(name = "work_hour_end", nullable = false)
    private Integer workHourEnd = 17;

    @Column(name = "buffer_minutes", nullable = false)
    private Integer bufferMinutes = 15;

    @Column(name = "high_energy_start")
    private Integer highEnergyStart;

    @Column(name = "high_energy_end")
    private Integer highEnergyEnd;

    @Column(name = "medium_energy_start")
    private Integer mediumEnergyStart;

    @Column(name = "medium_energy_end")
    private Integer mediumEnergyEnd;

    @Column(name = "low_energy_start")
    private Integer lowEnergyStart;

    @Column(name = "low_energy_end")
    private Integer lowEnergyEnd;

    @Column(name = "enforce_breaks", nullable = false)
    private Boolean enforceBreaks = Boolean.TRUE;

    @Column(name = "min_break_duration", nullable = false)
    private Integer minBreakDuration = 10;

    @Column(name = "max_consecutive_hours", nullable = false)
    private Integer maxConsecutiveHours = 3;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected AutoScheduleSettings() {
    }

    public AutoScheduleSettings(String userId) {
        this.userId = userId;
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
     * Snapshot for the scheduling core. Throws when the stored values break a policy invariant.
     */
    public SchedulingPolicy toPolicy() {
        Map<EnergyLevel, EnergyWindow> windows = new EnumMap<>(EnergyLevel.class);
        putWindow(windows, EnergyLevel.HIGH, EnergyWindow.ofNullable(highEnergyStart, highEnergyEnd));
        putWindow(windows, EnergyLevel.MEDIUM, EnergyWindow.ofNullable(mediumEnergyStart, mediumEnergyEnd));
        putWindow(windows, EnergyLevel.LOW, EnergyWindow.ofNullable(lowEnergyStart, lowEnergyEnd));
        return new SchedulingPolicy(
                workDays,
                workHourStart,
                workHourEnd,
                bufferMinutes,
                maxConsecutiveHours,
                minBreakDuration,
                Boolean.TRUE.equals(enforceBreaks),
                windows);
    }

    AutoScheduleSettings copy() {
        AutoScheduleSettings copy = new AutoScheduleSettings(userId);
        copy.workDays = EnumSet.noneOf(DayOfWeek.class);
        copy.workDays.addAll(workDays);
        copy.workHourStart = workHourStart;
        copy.workHourEnd = workHourEnd;
        copy.bufferMinutes = bufferMinutes;
        copy.highEnergyStart = highEnergyStart;
        copy.highEnergyEnd = highEnergyEnd;
        copy.mediumEnergyStart = mediumEnergyStart;
        copy.mediumEnergyEnd = mediumEnergyEnd;
        copy.lowEnergyStart = lowEnergyStart;
        copy.lowEnergyEnd = lowEnergyEnd;
        copy.enforceBreaks = enforceBreaks;
        copy.minBreakDuration = minBreakDuration;
        copy.maxConsecutiveHours = maxConsecutiveHours;
        return copy;
    }

    private static void putWindow(Map<EnergyLevel, EnergyWindow> windows, EnergyLevel level, EnergyWindow window) {
        if (window != null) {
            windows.put(level, window);
        }
    }

    public Long getId() { return id; }
    public String getUserId() { return userId; }
    public Set<DayOfWeek> getWorkDays() { return workDays; }
    public void setWorkDays(Set<DayOfWeek> workDays) { this.workDays = workDays; }
    public Integer getWorkHourStart() { return workHourStart; }
    public void setWorkHourStart(Integer workHourStart) { this.workHourStart = workHourStart; }
    public Integer getWorkHourEnd() { return workHourEnd; }
    public void setWorkHourEnd(Integer workHourEnd) { this.workHourEnd = workHourEnd; }
    public Integer getBufferMinutes() { return bufferMinutes; }
    public void setBufferMinutes(Integer bufferMinutes) { this.bufferMinutes = bufferMinutes; }
    public Integer getHighEnergyStart() { return highEnergyStart; }
    public void setHighEnergyStart(Integer highEnergyStart) { this.highEnergyStart = highEnergyStart; }
    public Integer getHighEnergyEnd() { return highEnergyEnd; }
    public void setHighEnergyEnd(Integer highEnergyEnd) { this.highEnergyEnd = highEnergyEnd; }
    public Integer getMediumEnergyStart() { return mediumEnergyStart; }
    public void setMediumEnergyStart(Integer mediumEnergyStart) { this.mediumEnergyStart = mediumEnergyStart; }
    public Integer getMediumEnergyEnd() { return mediumEnergyEnd; }
    public void setMediumEnergyEnd(Integer mediumEnergyEnd) { this.mediumEnergyEnd = mediumEnergyEnd; }
    public Integer getLowEnergyStart() { return lowEnergyStart; }
    public void setLowEnergyStart(Integer lowEnergyStart) { this.lowEnergyStart = lowEnergyStart; }
    public Integer getLowEnergyEnd() { return lowEnergyEnd; }
    public void setLowEnergyEnd(Integer lowEnergyEnd) { this.lowEnergyEnd = lowEnergyEnd; }
    public Boolean getEnforceBreaks() { return enforceBreaks; }
    public void setEnforceBreaks(Boolean enforceBreaks) { this.enforceBreaks = enforceBreaks; }
    public Integer getMinBreakDuration() { return minBreakDuration; }
    public void setMinBreakDuration(Integer minBreakDuration) { this.minBreakDuration = minBreakDuration; }
    public Integer getMaxConsecutiveHours() { return maxConsecutiveHours; }
    public void setMaxConsecutiveHours(Integer maxConsecutiveHours) { this.maxConsecutiveHours = maxConsecutiveHours; }
}
