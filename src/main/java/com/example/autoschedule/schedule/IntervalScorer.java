package com.example.autoschedule.schedule;

import com.example.autoschedule.settings.EnergyWindow;
import com.example.autoschedule.settings.SchedulingPolicy;
import com.example.autoschedule.task.EnergyLevel;
import com.example.autoschedule.task.Priority;
import com.example.autoschedule.task.TimePreference;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Desirability of placing a task at a candidate interval. Pure and deterministic.
 * <p>
 * The score is the sum of four parts:
 * <ul>
 *     <li>time of day, up to {@value #TIME_OF_DAY_WEIGHT}: full for the preferred part of the day, half without preference</li>
 *     <li>energy, up to {@value #ENERGY_WEIGHT}: full inside the user's window for the level, otherwise
 *     high energy favours the start of the work day, low energy its end, medium its middle</li>
 *     <li>urgency, up to {@value #URGENCY_WEIGHT}: grows as the slack before the due date shrinks</li>
 *     <li>priority: {@value #PRIORITY_STEP} per rank</li>
 * </ul>
 * Candidates ending after the due date are rejected by the engine before they reach the scorer.
 */
@Component
public class IntervalScorer {

    static final double TIME_OF_DAY_WEIGHT = 30.0;
    static final double ENERGY_WEIGHT = 30.0;
    static final double URGENCY_WEIGHT = 30.0;
    static final double PRIORITY_STEP = 2.5;

    private static final double MINUTES_PER_DAY = 24 * 60.0;

    public double score(TimeInterval candidate, PlannedTask task, SchedulingPolicy policy) {
        double total = timeOfDayScore(candidate, task.preferredTime())
                + energyScore(candidate, task.energyLevel(), policy)
                + urgencyScore(candidate, task.dueDate())
                + Priority.rankOf(task.priority()) * PRIORITY_STEP;
        return Math.round(total * 100.0) / 100.0;
    }

    double timeOfDayScore(TimeInterval candidate, TimePreference preferred) {
        if (preferred == null) {
            return TIME_OF_DAY_WEIGHT / 2;
        }
        return TimePreference.of(candidate.start().toLocalTime()) == preferred ? TIME_OF_DAY_WEIGHT : 0.0;
    }

    double energyScore(TimeInterval candidate, EnergyLevel level, SchedulingPolicy policy) {
        if (level == null) {
            return ENERGY_WEIGHT / 2;
        }
        Optional<EnergyWindow> window = policy.energyWindow(level);
        if (window.isPresent() && window.get().contains(candidate.start().toLocalTime())) {
            return ENERGY_WEIGHT;
        }
        double position = positionInWorkDay(candidate.start(), policy);
        return switch (level) {
            case HIGH -> ENERGY_WEIGHT * (1.0 - position);
            case LOW -> ENERGY_WEIGHT * position;
            case MEDIUM -> ENERGY_WEIGHT * (1.0 - Math.abs(2.0 * position - 1.0));
        };
    }

    double urgencyScore(TimeInterval candidate, LocalDateTime dueDate) {
        if (dueDate == null) {
            return 0.0;
        }
        long slackMinutes = Math.max(0, ChronoUnit.MINUTES.between(candidate.end(), dueDate));
        return URGENCY_WEIGHT / (1.0 + slackMinutes / MINUTES_PER_DAY);
    }

    // 0.0 at work start, 1.0 at work end
    private double positionInWorkDay(LocalDateTime start, SchedulingPolicy policy) {
        LocalDateTime dayStart = policy.workDayStart(start.toLocalDate());
        double offset = ChronoUnit.MINUTES.between(dayStart, start);
        double position = offset / policy.workSpanMinutes();
        return Math.min(1.0, Math.max(0.0, position));
    }
}
