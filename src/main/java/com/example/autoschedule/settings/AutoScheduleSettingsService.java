package com.example.autoschedule.settings;

import com.example.autoschedule.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Service
@Transactional
public class AutoScheduleSettingsService {

    private static final Logger logger = LoggerFactory.getLogger(AutoScheduleSettingsService.class);

    private final AutoScheduleSettingsRepository repository;

    public AutoScheduleSettingsService(AutoScheduleSettingsRepository repository) {
        this.repository = repository;
    }

    /**
     * 設定を取得（存在しない場合はデフォルトで作成）
     */
    public AutoScheduleSettings loadOrCreate(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return repository.findByUserId(userId).orElseGet(() -> {
            logger.info("Creating default auto-schedule settings for user {}", userId);
            return repository.save(new AutoScheduleSettings(userId));
        });
    }

    @Cacheable(cacheNames = CacheConfig.SCHEDULING_POLICIES, key = "#userId")
    public SchedulingPolicy resolvePolicy(String userId) {
        return loadOrCreate(userId).toPolicy();
    }

    /**
     * 設定を更新。null の項目は現在値を維持し、保存前にポリシーとして検証する。
     */
    @CacheEvict(cacheNames = CacheConfig.SCHEDULING_POLICIES, key = "#userId")
    public AutoScheduleSettings update(String userId, SettingsUpdate update) {
        AutoScheduleSettings entity = loadOrCreate(userId);

        // validate on a copy so a rejected update leaves the managed entity untouched
        AutoScheduleSettings candidate = entity.copy();
        apply(candidate, update);
        SchedulingPolicy policy = candidate.toPolicy();

        apply(entity, update);
        AutoScheduleSettings saved = repository.save(entity);
        logger.info("設定を更新しました: user={}, workHours={}-{}, enforceBreaks={}",
                userId, policy.workHourStart(), policy.workHourEnd(), policy.enforceBreaks());
        return saved;
    }

    private void apply(AutoScheduleSettings target, SettingsUpdate update) {
        if (update.workDays() != null) {
            target.setWorkDays(toDays(update.workDays()));
        }
        if (update.workHourStart() != null) target.setWorkHourStart(update.workHourStart());
        if (update.workHourEnd() != null) target.setWorkHourEnd(update.workHourEnd());
        if (update.bufferMinutes() != null) target.setBufferMinutes(update.bufferMinutes());
        if (update.maxConsecutiveHours() != null) target.setMaxConsecutiveHours(update.maxConsecutiveHours());
        if (update.minBreakDuration() != null) target.setMinBreakDuration(update.minBreakDuration());
        if (update.enforceBreaks() != null) target.setEnforceBreaks(update.enforceBreaks());
        if (update.highEnergyStart() != null) target.setHighEnergyStart(update.highEnergyStart());
        if (update.highEnergyEnd() != null) target.setHighEnergyEnd(update.highEnergyEnd());
        if (update.mediumEnergyStart() != null) target.setMediumEnergyStart(update.mediumEnergyStart());
        if (update.mediumEnergyEnd() != null) target.setMediumEnergyEnd(update.mediumEnergyEnd());
        if (update.lowEnergyStart() != null) target.setLowEnergyStart(update.lowEnergyStart());
        if (update.lowEnergyEnd() != null) target.setLowEnergyEnd(update.lowEnergyEnd());
    }

    private Set<DayOfWeek> toDays(List<Integer> ordinals) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (Integer ordinal : ordinals) {
            if (ordinal != null) {
                days.add(WorkDaysConverter.fromOrdinal(ordinal));
            }
        }
        return days;
    }

    public record SettingsUpdate(List<Integer> workDays,
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
    }
}
