package com.example.autoschedule.schedule;

import com.example.autoschedule.exception.ScheduleGenerationException;
import com.example.autoschedule.settings.SchedulingPolicy;
import com.example.autoschedule.task.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Greedy placement of auto-scheduled tasks.
 * <p>
 * Tasks are placed one at a time, most urgent first. For each task the engine walks forward day by day
 * from "now" (or the task's not-before date), tries every candidate start on the slot grid inside work
 * hours and keeps the best scoring candidate that satisfies the hard constraints. The first day with a
 * feasible candidate wins; later days are not examined. This is a heuristic, not an optimal solver.
 * <p>
 * Locked placements are treated as fixed busy time and returned untouched.
 */
@Component
public class SchedulingEngine {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingEngine.class);

    /** Due date ascending (none last), then priority descending, then shortest first. */
    static final Comparator<PlannedTask> PLACEMENT_ORDER = Comparator
            .comparing(PlannedTask::dueDate, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing((PlannedTask t) -> Priority.rankOf(t.priority()), Comparator.<Integer>reverseOrder())
            .thenComparingInt(PlannedTask::durationMinutes);

    private final IntervalScorer scorer;
    private final SchedulingProperties properties;
    private final Clock clock;

    public SchedulingEngine(IntervalScorer scorer, SchedulingProperties properties, Clock clock) {
        this.scorer = scorer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Places every unlocked task of {@code tasks} that fits.
     *
     * @param tasks         tasks to place; stale automatic placements are discarded, locked ones kept
     * @param lockedTasks   tasks whose placement is fixed busy time
     * @param policy        resolved policy of the user
     * @param busyIntervals external calendar commitments
     * @return all of {@code tasks} in input order, plus the ids that could not be placed
     * @throws ScheduleGenerationException when a task to place has a non-positive duration
     */
    public ScheduleRun scheduleMultipleTasks(List<PlannedTask> tasks,
                                             List<PlannedTask> lockedTasks,
                                             SchedulingPolicy policy,
                                             List<TimeInterval> busyIntervals) {
        if (policy == null) {
            throw new IllegalArgumentException("A scheduling policy is required");
        }
        List<PlannedTask> input = tasks == null ? List.of() : tasks;
        for (PlannedTask task : input) {
            if (!task.isLocked() && task.durationMinutes() <= 0) {
                throw ScheduleGenerationException.invalidDuration(task.id(), task.durationMinutes());
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<TimeInterval> occupied = new ArrayList<>();
        if (busyIntervals != null) {
            occupied.addAll(busyIntervals);
        }
        if (lockedTasks != null) {
            lockedTasks.stream()
                    .filter(PlannedTask::isScheduled)
                    .forEach(t -> occupied.add(t.interval()));
        }
        input.stream()
                .filter(PlannedTask::isLocked)
                .forEach(t -> occupied.add(t.interval()));

        logger.info("Scheduling {} tasks ({} locked, {} busy intervals) from {}",
                input.size(), lockedTasks == null ? 0 : lockedTasks.size(),
                busyIntervals == null ? 0 : busyIntervals.size(), now);

        List<PlannedTask> results = new ArrayList<>(input);
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            if (!input.get(i).isLocked()) {
                order.add(i);
            }
        }
        order.sort(Comparator.comparing(input::get, PLACEMENT_ORDER));

        List<Long> unplaced = new ArrayList<>();
        for (int index : order) {
            PlannedTask task = input.get(index);
            Optional<Candidate> slot = findSlot(task, policy, occupied, now);
            if (slot.isPresent()) {
                Candidate best = slot.get();
                occupied.add(best.interval());
                results.set(index, task.place(best.interval(), best.score(), now));
                logger.debug("Placed task {} at {} (score {})", task.id(), best.interval(), best.score());
            } else {
                results.set(index, task.unschedule());
                unplaced.add(task.id());
                logger.warn("No free slot for task {} (duration {}min, due {})",
                        task.id(), task.durationMinutes(), task.dueDate());
            }
        }

        logger.info("Scheduling finished: {} placed, {} unplaced", order.size() - unplaced.size(), unplaced.size());
        return new ScheduleRun(results, unplaced);
    }

    /**
     * Latest instant any task of this batch may be searched up to; callers use it to bound busy-interval lookups.
     */
    public LocalDateTime searchHorizonEnd(List<PlannedTask> tasks) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime horizon = now.toLocalDate().plusDays(properties.getHorizonDays() + 1L).atStartOfDay();
        for (PlannedTask task : tasks) {
            LocalDateTime taskEnd = task.dueDate() != null
                    ? task.dueDate()
                    : earliestStart(task, now).toLocalDate().plusDays(properties.getHorizonDays() + 1L).atStartOfDay();
            if (taskEnd.isAfter(horizon)) {
                horizon = taskEnd;
            }
        }
        return horizon;
    }

    private Optional<Candidate> findSlot(PlannedTask task,
                                         SchedulingPolicy policy,
                                         List<TimeInterval> occupied,
                                         LocalDateTime now) {
        LocalDateTime earliest = earliestStart(task, now);
        LocalDateTime due = task.dueDate();
        if (due != null && !due.isAfter(earliest)) {
            return Optional.empty();
        }
        LocalDate lastDay = due != null
                ? due.toLocalDate()
                : earliest.toLocalDate().plusDays(properties.getHorizonDays() - 1L);

        for (LocalDate day = earliest.toLocalDate(); !day.isAfter(lastDay); day = day.plusDays(1)) {
            if (!policy.isWorkDay(day)) {
                continue;
            }
            Optional<Candidate> best = bestOnDay(task, policy, occupied, day, earliest);
            if (best.isPresent()) {
                return best;
            }
        }
        return Optional.empty();
    }

    private Optional<Candidate> bestOnDay(PlannedTask task,
                                          SchedulingPolicy policy,
                                          List<TimeInterval> occupied,
                                          LocalDate day,
                                          LocalDateTime earliest) {
        int granularity = properties.getSlotGranularityMinutes();
        LocalDateTime dayStart = policy.workDayStart(day);
        LocalDateTime dayEnd = policy.workDayEnd(day);

        LocalDateTime start = dayStart;
        while (start.isBefore(earliest)) {
            start = start.plusMinutes(granularity);
        }

        Candidate best = null;
        for (; !start.plusMinutes(task.durationMinutes()).isAfter(dayEnd); start = start.plusMinutes(granularity)) {
            TimeInterval candidate = TimeInterval.of(start, task.durationMinutes());
            if (task.dueDate() != null && candidate.endsAfter(task.dueDate())) {
                break;
            }
            if (conflicts(candidate, occupied, policy.bufferMinutes())) {
                continue;
            }
            double score = scorer.score(candidate, task, policy);
            // strictly greater keeps the earliest start on ties
            if (best == null || score > best.score()) {
                best = new Candidate(candidate, score);
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean conflicts(TimeInterval candidate, List<TimeInterval> occupied, int bufferMinutes) {
        for (TimeInterval other : occupied) {
            if (!candidate.isSeparatedFrom(other, bufferMinutes)) {
                return true;
            }
        }
        return false;
    }

    private static LocalDateTime earliestStart(PlannedTask task, LocalDateTime now) {
        LocalDateTime notBefore = task.notBefore();
        return notBefore != null && notBefore.isAfter(now) ? notBefore : now;
    }

    private record Candidate(TimeInterval interval, double score) {
    }
}
