package com.example.autoschedule.schedule;

import com.example.autoschedule.breaks.BreakSuggestion;
import com.example.autoschedule.breaks.BreakViolation;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything a "reschedule all" run hands back: the stored tasks after the run, the tasks that need the
 * user's attention because no slot was found, and the break audit of the final schedule.
 */
public record RescheduleReport(String userId,
                               LocalDateTime scheduledAt,
                               List<TaskScheduleView> tasks,
                               List<Long> unplacedTaskIds,
                               List<BreakViolation> violations,
                               List<BreakSuggestion> suggestions,
                               int complianceScore) {
}
