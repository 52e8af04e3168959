package com.example.autoschedule.breaks;

import com.example.autoschedule.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users/{userId}/breaks")
public class BreakController {

    private final BreakReportService breakReportService;

    public BreakController(BreakReportService breakReportService) {
        this.breakReportService = breakReportService;
    }

    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<List<BreakViolation>>> validate(@PathVariable String userId,
                                                                      @Valid @RequestBody ValidateRequest request) {
        List<BreakViolation> violations = breakReportService.validateTasks(userId, request.taskIds());
        return ResponseEntity.ok(ApiResponse.success(null, violations, Map.of("count", violations.size())));
    }

    @GetMapping("/suggest")
    public ResponseEntity<ApiResponse<List<BreakSuggestion>>> suggest(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(ApiResponse.success(breakReportService.suggestForDay(userId, date)));
    }

    @GetMapping("/compliance")
    public ResponseEntity<ApiResponse<ComplianceResponse>> compliance(@PathVariable String userId,
                                                                      @RequestParam(defaultValue = "7") int days) {
        int score = breakReportService.complianceForUser(userId, days);
        return ResponseEntity.ok(ApiResponse.success(new ComplianceResponse(score, days)));
    }

    public record ValidateRequest(@NotEmpty List<Long> taskIds) {
    }

    public record ComplianceResponse(int score, int days) {
    }
}
