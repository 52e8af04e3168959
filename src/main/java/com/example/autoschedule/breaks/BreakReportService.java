package com.example.autoschedule.breaks;

import com.example.autoschedule.exception.TaskNotFoundException;
import com.example.autoschedule.schedule.PlannedTask;
import com.example.autoschedule.schedule.TaskPlanMapper;
import com.example.autoschedule.settings.AutoScheduleSettingsService;
import com.example.autoschedule.settings.SchedulingPolicy;
import com.example.autoschedule.task.Task;
import com.example.autoschedule.task.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 保存済みスケジュールに対する休憩チェック
 */
@Service
public class BreakReportService {

    private static final Logger logger = LoggerFactory.getLogger(BreakReportService.class);

    private final TaskRepository taskRepository;
    private final AutoScheduleSettingsService settingsService;
    private final TaskPlanMapper mapper;
    private final BreakAuditor auditor;
    private final BreakAdvisor advisor;
    private final Clock clock;

    public BreakReportService(TaskRepository taskRepository,
                              AutoScheduleSettingsService settingsService,
                              TaskPlanMapper mapper,
                              BreakAuditor auditor,
                              BreakAdvisor advisor,
                              Clock clock) {
        this.taskRepository = taskRepository;
        this.settingsService = settingsService;
        this.mapper = mapper;
        this.auditor = auditor;
        this.advisor = advisor;
        this.clock = clock;
    }

    /**
     * 指定タスクの休憩違反を検出
     */
    @Transactional
    public List<BreakViolation> validateTasks(String userId, List<Long> taskIds) {
        Set<Long> requested = new LinkedHashSet<>(taskIds);
        List<Task> tasks = taskRepository.findByUserIdAndIdIn(userId, requested);
        if (tasks.size() < requested.size()) {
            tasks.forEach(t -> requested.remove(t.getId()));
            throw new TaskNotFoundException(userId, requested);
        }
        SchedulingPolicy policy = settingsService.resolvePolicy(userId);
        return auditor.validateScheduleBreaks(mapper.toPlans(tasks), policy);
    }

    /**
     * 指定日の休憩提案
     */
    @Transactional
    public List<BreakSuggestion> suggestForDay(String userId, LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        SchedulingPolicy policy = settingsService.resolvePolicy(userId);
        List<Task> tasks = taskRepository
                .findByUserIdAndScheduledStartGreaterThanEqualAndScheduledStartLessThanOrderByScheduledStartAsc(
                        userId, day.atStartOfDay(), day.plusDays(1).atStartOfDay());
        List<BreakSuggestion> suggestions = advisor.suggestBreaks(mapper.toPlans(tasks), policy);
        logger.info("Suggested {} breaks for user {} on {}", suggestions.size(), userId, day);
        return suggestions;
    }

    /**
     * 直近 N 日間の休憩遵守スコア。N は 1 以上。
     */
    @Transactional
    public int complianceForUser(String userId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        LocalDateTime from = LocalDateTime.now(clock).minusDays(days);
        SchedulingPolicy policy = settingsService.resolvePolicy(userId);
        List<PlannedTask> tasks = mapper.toPlans(taskRepository.findByUserIdAndScheduledStartGreaterThanEqual(userId, from));
        int score = advisor.getBreakComplianceScore(tasks, policy);
        logger.info("Break compliance for user {} over {} days: {}", userId, days, score);
        return score;
    }
}
