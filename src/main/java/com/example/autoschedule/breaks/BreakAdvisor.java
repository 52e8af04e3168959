package com.example.autoschedule.breaks;

import com.example.autoschedule.schedule.PlannedTask;
import com.example.autoschedule.settings.SchedulingPolicy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns audit findings into break suggestions and a 0..100 compliance score.
 */
@Component
public class BreakAdvisor {

    static final int LUNCH_SUGGESTION_MINUTES = 60;
    private static final LocalTime LUNCH_SUGGESTION_TIME = LocalTime.NOON;

    private static final Comparator<BreakSuggestion> SUGGESTION_ORDER = Comparator
            .comparing((BreakSuggestion s) -> s.priority() == Severity.HIGH ? 0 : 1)
            .thenComparing(BreakSuggestion::suggestedTime);

    private final BreakAuditor auditor;

    public BreakAdvisor(BreakAuditor auditor) {
        this.auditor = auditor;
    }

    public List<BreakSuggestion> suggestBreaks(List<PlannedTask> tasks, SchedulingPolicy policy) {
        if (!policy.enforceBreaks()) {
            return List.of();
        }
        return suggestionsFor(auditor.validateScheduleBreaks(tasks, policy), policy);
    }

    /**
     * One suggestion per violation, high priority first, then by time.
     */
    public List<BreakSuggestion> suggestionsFor(List<BreakViolation> violations, SchedulingPolicy policy) {
        List<BreakSuggestion> suggestions = new ArrayList<>();
        for (BreakViolation violation : violations) {
            Severity priority = violation.severity() == Severity.HIGH ? Severity.HIGH : Severity.MEDIUM;
            switch (violation.type()) {
                case INSUFFICIENT_BREAK -> suggestions.add(new BreakSuggestion(
                        BreakSuggestion.Type.SHORT_BREAK,
                        violation.startTime(),
                        policy.minBreakDuration(),
                        violation.description(),
                        priority));
                case TOO_LONG_CONTINUOUS -> suggestions.add(new BreakSuggestion(
                        BreakSuggestion.Type.LONG_BREAK,
                        midpoint(violation.startTime(), violation.endTime()),
                        policy.minBreakDuration() * 2,
                        violation.description(),
                        priority));
                case NO_LUNCH_BREAK -> suggestions.add(new BreakSuggestion(
                        BreakSuggestion.Type.LUNCH,
                        violation.startTime().toLocalDate().atTime(LUNCH_SUGGESTION_TIME),
                        LUNCH_SUGGESTION_MINUTES,
                        violation.description(),
                        Severity.HIGH));
            }
        }
        suggestions.sort(SUGGESTION_ORDER);
        return suggestions;
    }

    /**
     * True when adding {@code newTask} to {@code existingTasks} creates no violation naming it.
     */
    public boolean canScheduleWithoutViolation(PlannedTask newTask, List<PlannedTask> existingTasks,
                                               SchedulingPolicy policy) {
        if (!policy.enforceBreaks()) {
            return true;
        }
        List<PlannedTask> all = new ArrayList<>(existingTasks);
        all.add(newTask);
        return auditor.validateScheduleBreaks(all, policy).stream()
                .noneMatch(v -> v.involves(newTask.id()));
    }

    /**
     * 100 when breaks are not enforced or nothing is scheduled; otherwise the severity weights of all
     * violations measured against three points per scheduled task. Unscheduled tasks do not count.
     */
    public int getBreakComplianceScore(List<PlannedTask> tasks, SchedulingPolicy policy) {
        List<PlannedTask> scheduled = BreakAuditor.scheduledInOrder(tasks);
        if (!policy.enforceBreaks() || scheduled.isEmpty()) {
            return 100;
        }
        List<BreakViolation> violations = auditor.validateScheduleBreaks(scheduled, policy);
        int totalPenalty = violations.stream().mapToInt(v -> v.severity().weight()).sum();
        double maxPenalty = (double) scheduled.size() * Severity.MAX_WEIGHT;
        long score = Math.round(100.0 * (1.0 - totalPenalty / maxPenalty));
        return (int) Math.max(0, score);
    }

    private static LocalDateTime midpoint(LocalDateTime start, LocalDateTime end) {
        return start.plus(Duration.between(start, end).dividedBy(2));
    }
}
