package com.example.autoschedule.settings;

import com.example.autoschedule.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/auto-schedule-settings")
public class AutoScheduleSettingsController {

    private final AutoScheduleSettingsService settingsService;

    public AutoScheduleSettingsController(AutoScheduleSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<SettingsResponse>> get(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(SettingsResponse.from(settingsService.loadOrCreate(userId))));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<SettingsResponse>> update(@PathVariable String userId,
                                                                @Valid @RequestBody SettingsRequest request) {
        AutoScheduleSettings saved = settingsService.update(userId, request.toUpdate());
        return ResponseEntity.ok(ApiResponse.success(SettingsResponse.from(saved)));
    }

    public record SettingsRequest(List<@Min(0) @Max(6) Integer> workDays,
                                  @Min(0) @Max(23) Integer workHourStart,
                                  @Min(1) @Max(24) Integer workHourEnd,
                                  @Min(0) Integer bufferMinutes,
                                  @Min(1) Integer maxConsecutiveHours,
                                  @Min(0) Integer minBreakDuration,
                                  Boolean enforceBreaks,
                                  @Min(0) @Max(23) Integer highEnergyStart,
                                  @Min(1) @Max(24) Integer highEnergyEnd,
                                  @Min(0) @Max(23) Integer mediumEnergyStart,
                                  @Min(1) @Max(24) Integer mediumEnergyEnd,
                                  @Min(0) @Max(23) Integer lowEnergyStart,
                                  @Min(1) @Max(24) Integer lowEnergyEnd) {

        AutoScheduleSettingsService.SettingsUpdate toUpdate() {
            return new AutoScheduleSettingsService.SettingsUpdate(workDays, workHourStart, workHourEnd,
                    bufferMinutes, maxConsecutiveHours, minBreakDuration, enforceBreaks,
                    highEnergyStart, highEnergyEnd, mediumEnergyStart, mediumEnergyEnd,
                    lowEnergyStart, lowEnergyEnd);
        }
    }

    public record SettingsResponse(String userId,
                                   List<Integer> workDays,
                                   Integer workHourStart,
                                   Integer workHourEnd,
                                   Integer bufferMinutes,
                                   Integer maxConsecutiveHours,
                                   Integer minBreakDuration,
                                   Boolean enforceBreaks,
                                   Integer highEnergyStart,
                                   Integer highEnergyEnd,
                                   Integer mediumEnergyStart,
                                   Integer mediumEnergyEnd,
                                   Integer lowEnergyStart,
                                   Integer lowEnergyEnd) {

        static SettingsResponse from(AutoScheduleSettings s) {
            List<Integer> days = s.getWorkDays().stream()
                    .map(WorkDaysConverter::toOrdinal)
                    .sorted()
                    .toList();
            return new SettingsResponse(s.getUserId(), days, s.getWorkHourStart(), s.getWorkHourEnd(),
                    s.getBufferMinutes(), s.getMaxConsecutiveHours(), s.getMinBreakDuration(), s.getEnforceBreaks(),
                    s.getHighEnergyStart(), s.getHighEnergyEnd(), s.getMediumEnergyStart(), s.getMediumEnergyEnd(),
                    s.getLowEnergyStart(), s.getLowEnergyEnd());
        }
    }
}
