package com.example.autoschedule.breaks;

import com.example.autoschedule.schedule.PlannedTask;
import com.example.autoschedule.settings.SchedulingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes auto-placed tasks later so the schedule satisfies the break policy.
 * <p>
 * Single forward sweep in start order with a cumulative offset that only grows. After each task:
 * <ul>
 *     <li>a gap shorter than the minimum break is widened to the minimum break</li>
 *     <li>once the running work block reaches the consecutive-hours limit a break of twice the
 *     minimum is required and the block restarts</li>
 * </ul>
 * Whichever requirement is larger wins, and every later task moves by the missing minutes.
 * Tasks never move earlier and their order never changes. Locked tasks are not part of the sweep.
 * Shifted tasks are not re-checked against calendar busy time.
 */
@Component
public class BreakEnforcer {

    private static final Logger logger = LoggerFactory.getLogger(BreakEnforcer.class);

    public List<PlannedTask> enforceBreaksInSchedule(List<PlannedTask> tasks, SchedulingPolicy policy) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }
        if (!policy.enforceBreaks()) {
            return List.copyOf(tasks);
        }

        List<PlannedTask> chain = tasks.stream()
                .filter(t -> t.placement().isAutoPlaced())
                .sorted(Comparator.comparing(PlannedTask::scheduledStart))
                .toList();
        if (chain.isEmpty()) {
            return List.copyOf(tasks);
        }

        int minBreak = policy.minBreakDuration();
        int blockLimit = policy.maxConsecutiveMinutes();
        Map<PlannedTask, PlannedTask> shifted = new IdentityHashMap<>();
        long offset = 0;
        long blockMinutes = 0;

        for (int i = 0; i < chain.size(); i++) {
            PlannedTask current = chain.get(i);
            PlannedTask moved = offset > 0 ? current.shiftedBy(offset) : current;
            shifted.put(current, moved);
            blockMinutes += BreakAuditor.workMinutes(current);

            if (i == chain.size() - 1) {
                break;
            }
            PlannedTask next = chain.get(i + 1);
            // next has not been moved yet; it will receive the same offset
            long gap = moved.interval().gapTo(next.interval().shiftedBy(offset));

            long requiredBreak = 0;
            if (gap >= 0 && gap < minBreak) {
                requiredBreak = minBreak;
            }
            if (blockMinutes >= blockLimit) {
                requiredBreak = Math.max(requiredBreak, 2L * minBreak);
                blockMinutes = 0;
            }
            if (requiredBreak > 0 && requiredBreak - gap > 0) {
                offset += requiredBreak - gap;
                logger.debug("Inserted {}min after task {}, cumulative offset {}min",
                        requiredBreak - gap, current.id(), offset);
            }
        }

        List<PlannedTask> result = new ArrayList<>(tasks.size());
        for (PlannedTask task : tasks) {
            result.add(shifted.getOrDefault(task, task));
        }
        if (offset > 0) {
            logger.info("Enforced breaks across {} tasks, total offset {} minutes", chain.size(), offset);
        }
        return result;
    }
}
