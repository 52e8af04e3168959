package com.example.autoschedule.schedule;

import com.example.autoschedule.breaks.BreakAdvisor;
import com.example.autoschedule.breaks.BreakAuditor;
import com.example.autoschedule.breaks.BreakEnforcer;
import com.example.autoschedule.breaks.BreakSuggestion;
import com.example.autoschedule.breaks.BreakViolation;
import com.example.autoschedule.settings.AutoScheduleSettingsService;
import com.example.autoschedule.settings.SchedulingPolicy;
import com.example.autoschedule.task.Task;
import com.example.autoschedule.task.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * "Reschedule all" for one user: clear stale placements, place every candidate, enforce breaks,
 * audit the result and store it.
 * <p>
 * The whole read-clear-place-write sequence runs inside the user's lock and one transaction;
 * the lock is held until the transaction has committed or rolled back.
 */
@Service
public class TaskSchedulingService {

    private static final Logger logger = LoggerFactory.getLogger(TaskSchedulingService.class);

    private final TaskRepository taskRepository;
    private final AutoScheduleSettingsService settingsService;
    private final SchedulingEngine engine;
    private final BreakEnforcer breakEnforcer;
    private final BreakAuditor breakAuditor;
    private final BreakAdvisor breakAdvisor;
    private final TaskPlanMapper mapper;
    private final BusyIntervalProvider busyIntervalProvider;
    private final UserScheduleLocks locks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TaskSchedulingService(TaskRepository taskRepository,
                                 AutoScheduleSettingsService settingsService,
                                 SchedulingEngine engine,
                                 BreakEnforcer breakEnforcer,
                                 BreakAuditor breakAuditor,
                                 BreakAdvisor breakAdvisor,
                                 TaskPlanMapper mapper,
                                 BusyIntervalProvider busyIntervalProvider,
                                 UserScheduleLocks locks,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.taskRepository = taskRepository;
        this.settingsService = settingsService;
        this.engine = engine;
        this.breakEnforcer = breakEnforcer;
        this.breakAuditor = breakAuditor;
        this.breakAdvisor = breakAdvisor;
        this.mapper = mapper;
        this.busyIntervalProvider = busyIntervalProvider;
        this.locks = locks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public RescheduleReport scheduleAllTasksForUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return locks.withLock(userId, () -> transactionTemplate.execute(status -> {
            try {
                return reschedule(userId);
            } catch (RuntimeException e) {
                logger.error("Error scheduling tasks for user {}: {}", userId, e.getMessage());
                throw e;
            }
        }));
    }

    private RescheduleReport reschedule(String userId) {
        logger.info("Starting task scheduling for user {}", userId);
        SchedulingPolicy policy = settingsService.resolvePolicy(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<Task> candidates = taskRepository.findSchedulingCandidates(userId);
        List<Task> lockedTasks = taskRepository.findLockedTasks(userId);
        logger.info("Found {} tasks to schedule and {} locked tasks", candidates.size(), lockedTasks.size());

        candidates.forEach(Task::clearSchedule);
        List<PlannedTask> plans = mapper.toPlans(candidates);
        List<PlannedTask> lockedPlans = mapper.toPlans(lockedTasks).stream()
                .filter(PlannedTask::isLocked)
                .toList();

        List<TimeInterval> busy = busyIntervalProvider.findBusyIntervals(userId, now, engine.searchHorizonEnd(plans));
        ScheduleRun run = engine.scheduleMultipleTasks(plans, lockedPlans, policy, busy);

        List<PlannedTask> placed = run.tasks();
        if (policy.enforceBreaks()) {
            placed = breakEnforcer.enforceBreaksInSchedule(placed, policy);
        }

        Map<Long, Task> byId = candidates.stream().collect(Collectors.toMap(Task::getId, Function.identity()));
        for (PlannedTask plan : placed) {
            Task task = byId.get(plan.id());
            mapper.apply(plan, task);
            task.setLastScheduled(now);
        }
        taskRepository.saveAll(candidates);

        List<PlannedTask> finalSchedule = new ArrayList<>(placed);
        finalSchedule.addAll(lockedPlans);
        List<BreakViolation> violations = breakAuditor.validateScheduleBreaks(finalSchedule, policy);
        List<BreakSuggestion> suggestions = policy.enforceBreaks()
                ? breakAdvisor.suggestionsFor(violations, policy)
                : List.of();
        int compliance = breakAdvisor.getBreakComplianceScore(finalSchedule, policy);

        List<TaskScheduleView> views = new ArrayList<>();
        candidates.forEach(t -> views.add(TaskScheduleView.from(t)));
        lockedTasks.forEach(t -> views.add(TaskScheduleView.from(t)));

        logger.info("Task scheduling completed for user {}: {} placed, {} unplaced, compliance {}",
                userId, run.placedCount(), run.unplacedTaskIds().size(), compliance);
        return new RescheduleReport(userId, now, views, run.unplacedTaskIds(), violations, suggestions, compliance);
    }
}
