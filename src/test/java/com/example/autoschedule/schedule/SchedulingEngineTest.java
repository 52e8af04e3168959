package com.example.autoschedule.schedule;

import com.example.autoschedule.exception.ScheduleGenerationException;
import com.example.autoschedule.settings.EnergyWindow;
import com.example.autoschedule.settings.SchedulingPolicy;
import com.example.autoschedule.task.EnergyLevel;
import com.example.autoschedule.task.Priority;
import com.example.autoschedule.task.TimePreference;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulingEngineTest {

    // Monday
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 3, 8, 0);
    private static final LocalDateTime MONDAY = NOW.toLocalDate().atStartOfDay();
    private static final LocalDateTime TUESDAY = MONDAY.plusDays(1);

    private final SchedulingPolicy policy = SchedulingPolicy.defaults();

    private SchedulingEngine engineAt(LocalDateTime now) {
        Clock clock = Clock.fixed(now.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new SchedulingEngine(new IntervalScorer(), SchedulingProperties.defaults(), clock);
    }

    private ScheduleRun schedule(List<PlannedTask> tasks) {
        return engineAt(NOW).scheduleMultipleTasks(tasks, List.of(), policy, List.of());
    }

    @Test
    void scheduleMultipleTasks_placesTaskAtFirstWorkHourWithExactDuration() {
        ScheduleRun run = schedule(List.of(PlannedTask.builder(1, 60).build()));

        PlannedTask placed = run.tasks().get(0);
        assertThat(placed.scheduledStart()).isEqualTo(MONDAY.withHour(9));
        assertThat(placed.scheduledEnd()).isEqualTo(MONDAY.withHour(10));
        assertThat(placed.scheduleScore()).isEqualTo(30.0);
        assertThat(placed.lastScheduled()).isEqualTo(NOW);
        assertThat(placed.placement().isAutoPlaced()).isTrue();
        assertThat(run.unplacedTaskIds()).isEmpty();
    }

    @Test
    void scheduleMultipleTasks_keepsBufferBetweenTasksAndStaysInsideWorkHours() {
        List<PlannedTask> tasks = new ArrayList<>();
        for (long id = 1; id <= 7; id++) {
            tasks.add(PlannedTask.builder(id, 90).build());
        }

        ScheduleRun run = schedule(tasks);

        assertThat(run.unplacedTaskIds()).isEmpty();
        List<PlannedTask> placed = run.tasks();
        for (PlannedTask task : placed) {
            TimeInterval interval = task.interval();
            assertThat(interval.durationMinutes()).isEqualTo(task.durationMinutes());
            assertThat(policy.isWorkDay(interval.day())).isTrue();
            assertThat(interval.start()).isAfterOrEqualTo(policy.workDayStart(interval.day()));
            assertThat(interval.end()).isBeforeOrEqualTo(policy.workDayEnd(interval.day()));
        }
        for (int i = 0; i < placed.size(); i++) {
            for (int j = i + 1; j < placed.size(); j++) {
                assertThat(placed.get(i).interval().isSeparatedFrom(placed.get(j).interval(), policy.bufferMinutes()))
                        .as("tasks %d and %d are separated by the buffer", placed.get(i).id(), placed.get(j).id())
                        .isTrue();
            }
        }
    }

    @Test
    void scheduleMultipleTasks_skipsWeekendWhenFridayIsFull() {
        LocalDateTime fridayAfternoon = LocalDateTime.of(2025, 3, 7, 16, 30);

        ScheduleRun run = engineAt(fridayAfternoon)
                .scheduleMultipleTasks(List.of(PlannedTask.builder(1, 60).build()), List.of(), policy, List.of());

        assertThat(run.tasks().get(0).scheduledStart()).isEqualTo(LocalDateTime.of(2025, 3, 10, 9, 0));
        assertThat(run.tasks().get(0).scheduledStart().getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
    }

    @Test
    void scheduleMultipleTasks_neverRewritesLockedTasksAndAvoidsThem() {
        PlannedTask lockedOutside = PlannedTask.builder(10, 180).lockedAt(MONDAY.withHour(9)).build();
        PlannedTask lockedInBatch = PlannedTask.builder(11, 60).lockedAt(MONDAY.withHour(14)).build();
        PlannedTask task = PlannedTask.builder(1, 60).build();

        ScheduleRun run = engineAt(NOW).scheduleMultipleTasks(
                List.of(lockedInBatch, task), List.of(lockedOutside), policy, List.of());

        assertThat(run.tasks().get(0)).isSameAs(lockedInBatch);
        PlannedTask placed = run.tasks().get(1);
        assertThat(placed.scheduledStart()).isEqualTo(MONDAY.withHour(12).withMinute(15));
        assertThat(placed.interval().isSeparatedFrom(lockedInBatch.interval(), policy.bufferMinutes())).isTrue();
    }

    @Test
    void scheduleMultipleTasks_movesToNextDayWhenBusyIntervalPlusBufferBlocksToday() {
        List<TimeInterval> busy = List.of(new TimeInterval(MONDAY.withHour(9), MONDAY.withHour(16)));

        ScheduleRun run = engineAt(NOW).scheduleMultipleTasks(
                List.of(PlannedTask.builder(1, 60).build()), List.of(), policy, busy);

        assertThat(run.tasks().get(0).scheduledStart()).isEqualTo(TUESDAY.withHour(9));
    }

    @Test
    void scheduleMultipleTasks_leavesTaskUnplacedWhenNoSlotBeforeDueDateAndContinues() {
        List<TimeInterval> busy = List.of(new TimeInterval(MONDAY.withHour(9), MONDAY.withHour(12)));
        PlannedTask impossible = PlannedTask.builder(1, 60).dueDate(MONDAY.withHour(11)).build();
        PlannedTask other = PlannedTask.builder(2, 30).build();

        ScheduleRun run = engineAt(NOW).scheduleMultipleTasks(List.of(impossible, other), List.of(), policy, busy);

        assertThat(run.unplacedTaskIds()).containsExactly(1L);
        assertThat(run.tasks().get(0).isScheduled()).isFalse();
        assertThat(run.tasks().get(0).scheduledStart()).isNull();
        assertThat(run.tasks().get(0).scheduleScore()).isNull();
        assertThat(run.tasks().get(1).scheduledStart()).isEqualTo(MONDAY.withHour(12).withMinute(15));
        assertThat(run.isFullyPlaced()).isFalse();
    }

    @Test
    void scheduleMultipleTasks_leavesOverdueTaskUnplaced() {
        PlannedTask overdue = PlannedTask.builder(1, 30).dueDate(NOW.minusDays(1)).build();

        ScheduleRun run = schedule(List.of(overdue));

        assertThat(run.unplacedTaskIds()).containsExactly(1L);
    }

    @Test
    void scheduleMultipleTasks_placesDueTaskOnFirstFeasibleDayAsCloseToDueDateAsPossible() {
        LocalDateTime due = TUESDAY.withHour(12);
        PlannedTask task = PlannedTask.builder(1, 60).dueDate(due).build();

        PlannedTask placed = schedule(List.of(task)).tasks().get(0);

        assertThat(placed.scheduledEnd()).isBeforeOrEqualTo(due);
        assertThat(placed.scheduledStart().toLocalDate()).isEqualTo(MONDAY.toLocalDate());
        assertThat(placed.scheduledStart()).isEqualTo(MONDAY.withHour(16));
    }

    @Test
    void scheduleMultipleTasks_honoursPreferredTimeOfDay() {
        PlannedTask afternoon = PlannedTask.builder(1, 60).preferredTime(TimePreference.AFTERNOON).build();

        PlannedTask placed = schedule(List.of(afternoon)).tasks().get(0);

        assertThat(placed.scheduledStart()).isEqualTo(MONDAY.withHour(12));
    }

    @Test
    void scheduleMultipleTasks_putsHighEnergyEarlyAndLowEnergyLate() {
        PlannedTask high = PlannedTask.builder(1, 60).energyLevel(EnergyLevel.HIGH).build();
        PlannedTask low = PlannedTask.builder(2, 60).energyLevel(EnergyLevel.LOW).build();

        assertThat(schedule(List.of(high)).tasks().get(0).scheduledStart()).isEqualTo(MONDAY.withHour(9));
        assertThat(schedule(List.of(low)).tasks().get(0).scheduledStart()).isEqualTo(MONDAY.withHour(16));
    }

    @Test
    void scheduleMultipleTasks_prefersConfiguredEnergyWindow() {
        SchedulingPolicy withWindow = policy.withEnergyWindow(EnergyLevel.LOW, new EnergyWindow(9, 10));
        PlannedTask low = PlannedTask.builder(1, 60).energyLevel(EnergyLevel.LOW).build();

        ScheduleRun run = engineAt(NOW).scheduleMultipleTasks(List.of(low), List.of(), withWindow, List.of());

        assertThat(run.tasks().get(0).scheduledStart()).isEqualTo(MONDAY.withHour(9));
    }

    @Test
    void scheduleMultipleTasks_startsOnGridAfterNotBeforeDate() {
        PlannedTask task = PlannedTask.builder(1, 30).notBefore(TUESDAY.withHour(10).withMinute(7)).build();

        PlannedTask placed = schedule(List.of(task)).tasks().get(0);

        assertThat(placed.scheduledStart()).isEqualTo(TUESDAY.withHour(10).withMinute(15));
    }

    @Test
    void scheduleMultipleTasks_placesEarlierDueDateAndHigherPriorityFirst() {
        PlannedTask noDue = PlannedTask.builder(1, 480).priority(Priority.HIGH).build();
        PlannedTask due = PlannedTask.builder(2, 480).dueDate(MONDAY.plusDays(2).withHour(17)).build();
        PlannedTask lowPriority = PlannedTask.builder(3, 480).priority(Priority.LOW).build();

        ScheduleRun run = schedule(List.of(noDue, due, lowPriority));

        assertThat(run.tasks().get(1).scheduledStart()).isEqualTo(MONDAY.withHour(9));
        assertThat(run.tasks().get(0).scheduledStart()).isEqualTo(TUESDAY.withHour(9));
        assertThat(run.tasks().get(2).scheduledStart()).isEqualTo(MONDAY.plusDays(2).withHour(9));
    }

    @Test
    void scheduleMultipleTasks_discardsStalePlacement() {
        PlannedTask stale = PlannedTask.builder(1, 60).scheduledAt(MONDAY.plusDays(2).withHour(15)).build();

        PlannedTask placed = schedule(List.of(stale)).tasks().get(0);

        assertThat(placed.scheduledStart()).isEqualTo(MONDAY.withHour(9));
    }

    @Test
    void scheduleMultipleTasks_givesUpAfterHorizonWithoutDueDate() {
        List<TimeInterval> busy = List.of(new TimeInterval(NOW, NOW.plusDays(30)));

        ScheduleRun run = engineAt(NOW).scheduleMultipleTasks(
                List.of(PlannedTask.builder(1, 30).build()), List.of(), policy, busy);

        assertThat(run.unplacedTaskIds()).containsExactly(1L);
    }

    @Test
    void scheduleMultipleTasks_isDeterministicForIdenticalInput() {
        List<PlannedTask> tasks = List.of(
                PlannedTask.builder(1, 45).energyLevel(EnergyLevel.MEDIUM).build(),
                PlannedTask.builder(2, 120).preferredTime(TimePreference.MORNING).priority(Priority.HIGH).build(),
                PlannedTask.builder(3, 30).dueDate(TUESDAY.withHour(15)).build(),
                PlannedTask.builder(4, 60).energyLevel(EnergyLevel.LOW).preferredTime(TimePreference.EVENING).build());
        List<TimeInterval> busy = List.of(new TimeInterval(MONDAY.withHour(13), MONDAY.withHour(14)));

        ScheduleRun first = engineAt(NOW).scheduleMultipleTasks(tasks, List.of(), policy, busy);
        ScheduleRun second = engineAt(NOW).scheduleMultipleTasks(tasks, List.of(), policy, busy);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void scheduleMultipleTasks_rejectsNonPositiveDuration() {
        assertThatThrownBy(() -> schedule(List.of(PlannedTask.builder(7, 0).build())))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting(e -> ((ScheduleGenerationException) e).getErrorCode())
                .isEqualTo(ScheduleGenerationException.INVALID_TASK_DURATION);
    }

    @Test
    void scheduleMultipleTasks_requiresPolicy() {
        assertThatThrownBy(() -> engineAt(NOW).scheduleMultipleTasks(List.of(), List.of(), null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
