package com.example.autoschedule.breaks;

import com.example.autoschedule.schedule.PlannedTask;
import com.example.autoschedule.schedule.SchedulingProperties;
import com.example.autoschedule.schedule.TimeInterval;
import com.example.autoschedule.settings.SchedulingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects break policy violations in a placed schedule.
 * <p>
 * Three rules run in order and their findings are concatenated without deduplication:
 * <ol>
 *     <li>insufficient break: a non-negative gap shorter than the minimum break</li>
 *     <li>too long continuous: a work block (tasks chained by gaps shorter than the minimum break)
 *     longer than the allowed consecutive hours</li>
 *     <li>no lunch break: two or more tasks starting in the lunch window of one day with no gap of
 *     the lunch length between them; a single task filling the window is not reported</li>
 * </ol>
 */
@Component
public class BreakAuditor {

    private static final Logger logger = LoggerFactory.getLogger(BreakAuditor.class);

    private static final int HIGH_SEVERITY_GAP_MINUTES = 5;
    private static final double HIGH_SEVERITY_BLOCK_FACTOR = 1.5;

    private final SchedulingProperties properties;

    public BreakAuditor(SchedulingProperties properties) {
        this.properties = properties;
    }

    public List<BreakViolation> validateScheduleBreaks(List<PlannedTask> tasks, SchedulingPolicy policy) {
        List<BreakViolation> violations = new ArrayList<>();
        List<PlannedTask> scheduled = scheduledInOrder(tasks);
        if (scheduled.isEmpty()) {
            return violations;
        }

        checkGaps(scheduled, policy, violations);
        checkWorkBlocks(scheduled, policy, violations);
        checkLunch(scheduled, violations);

        logger.info("Found {} break violations in {} scheduled tasks", violations.size(), scheduled.size());
        return violations;
    }

    static List<PlannedTask> scheduledInOrder(List<PlannedTask> tasks) {
        if (tasks == null) {
            return List.of();
        }
        return tasks.stream()
                .filter(PlannedTask::isScheduled)
                .sorted(Comparator.comparing(PlannedTask::scheduledStart))
                .toList();
    }

    private void checkGaps(List<PlannedTask> scheduled, SchedulingPolicy policy, List<BreakViolation> violations) {
        int minBreak = policy.minBreakDuration();
        for (int i = 0; i < scheduled.size() - 1; i++) {
            PlannedTask current = scheduled.get(i);
            PlannedTask next = scheduled.get(i + 1);
            long gap = current.interval().gapTo(next.interval());
            if (gap >= 0 && gap < minBreak) {
                violations.add(new BreakViolation(
                        ViolationType.INSUFFICIENT_BREAK,
                        List.of(current.id(), next.id()),
                        current.scheduledEnd(),
                        next.scheduledStart(),
                        String.format("Only %d minutes between tasks (minimum: %d minutes)", gap, minBreak),
                        gap < HIGH_SEVERITY_GAP_MINUTES ? Severity.HIGH : Severity.MEDIUM,
                        String.format("Add %d more minutes between tasks", minBreak - gap)));
            }
        }
    }

    private void checkWorkBlocks(List<PlannedTask> scheduled, SchedulingPolicy policy, List<BreakViolation> violations) {
        List<PlannedTask> block = new ArrayList<>();
        long blockMinutes = 0;
        for (PlannedTask task : scheduled) {
            if (!block.isEmpty()) {
                PlannedTask previous = block.get(block.size() - 1);
                if (previous.interval().gapTo(task.interval()) >= policy.minBreakDuration()) {
                    reportLongBlock(block, blockMinutes, policy, violations);
                    block = new ArrayList<>();
                    blockMinutes = 0;
                }
            }
            block.add(task);
            blockMinutes += workMinutes(task);
        }
        reportLongBlock(block, blockMinutes, policy, violations);
    }

    private void reportLongBlock(List<PlannedTask> block,
                                 long blockMinutes,
                                 SchedulingPolicy policy,
                                 List<BreakViolation> violations) {
        int limit = policy.maxConsecutiveMinutes();
        if (block.isEmpty() || blockMinutes <= limit) {
            return;
        }
        PlannedTask first = block.get(0);
        PlannedTask last = block.get(block.size() - 1);
        violations.add(new BreakViolation(
                ViolationType.TOO_LONG_CONTINUOUS,
                block.stream().map(PlannedTask::id).toList(),
                first.scheduledStart(),
                last.scheduledEnd(),
                String.format("Continuous work for %d hours without adequate break (maximum: %d hours)",
                        Math.round(blockMinutes / 60.0), policy.maxConsecutiveHours()),
                blockMinutes > limit * HIGH_SEVERITY_BLOCK_FACTOR ? Severity.HIGH : Severity.MEDIUM,
                String.format("Add a %d-minute break after %d hours of work",
                        policy.minBreakDuration(), policy.maxConsecutiveHours())));
    }

    /**
     * Lunch is judged per calendar day: tasks in the window on different days never combine into
     * one finding, and one crowded day is reported even when other days have a proper lunch.
     */
    private void checkLunch(List<PlannedTask> scheduled, List<BreakViolation> violations) {
        LocalTime windowStart = properties.getLunchWindowStart();
        LocalTime windowEnd = properties.getLunchWindowEnd();
        Map<LocalDate, List<PlannedTask>> lunchTasksByDay = new LinkedHashMap<>();
        for (PlannedTask task : scheduled) {
            LocalTime start = task.scheduledStart().toLocalTime();
            if (!start.isBefore(windowStart) && !start.isAfter(windowEnd)) {
                lunchTasksByDay.computeIfAbsent(task.scheduledStart().toLocalDate(), d -> new ArrayList<>()).add(task);
            }
        }

        lunchTasksByDay.forEach((day, lunchTasks) -> {
            if (lunchTasks.size() < 2 || hasLunchGap(lunchTasks)) {
                return;
            }
            violations.add(new BreakViolation(
                    ViolationType.NO_LUNCH_BREAK,
                    lunchTasks.stream().map(PlannedTask::id).toList(),
                    lunchTasks.get(0).scheduledStart(),
                    lunchTasks.get(lunchTasks.size() - 1).scheduledEnd(),
                    String.format("No lunch break detected during typical lunch hours (%s-%s)", windowStart, windowEnd),
                    Severity.MEDIUM,
                    "Add a 30-60 minute lunch break between 12:00 and 13:00"));
        });
    }

    private boolean hasLunchGap(List<PlannedTask> lunchTasks) {
        for (int i = 0; i < lunchTasks.size() - 1; i++) {
            TimeInterval current = lunchTasks.get(i).interval();
            TimeInterval next = lunchTasks.get(i + 1).interval();
            if (current.gapTo(next) >= properties.getLunchMinGapMinutes()) {
                return true;
            }
        }
        return false;
    }

    static long workMinutes(PlannedTask task) {
        return task.durationMinutes() > 0 ? task.durationMinutes() : task.interval().durationMinutes();
    }
}
