package com.example.autoschedule.schedule;

import com.example.autoschedule.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/users/{userId}/schedule")
public class TaskSchedulingController {

    private final TaskSchedulingService schedulingService;

    public TaskSchedulingController(TaskSchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    @PostMapping("/run")
    public ResponseEntity<ApiResponse<RescheduleReport>> run(@PathVariable String userId) {
        RescheduleReport report = schedulingService.scheduleAllTasksForUser(userId);
        String message = report.unplacedTaskIds().isEmpty()
                ? "All tasks scheduled"
                : report.unplacedTaskIds().size() + " tasks could not be scheduled";
        return ResponseEntity.ok(ApiResponse.success(message, report, Map.of(
                "taskCount", report.tasks().size(),
                "unplacedCount", report.unplacedTaskIds().size(),
                "complianceScore", report.complianceScore())));
    }
}
