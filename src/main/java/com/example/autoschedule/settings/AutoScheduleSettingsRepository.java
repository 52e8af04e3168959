package com.example.autoschedule.settings;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AutoScheduleSettingsRepository extends JpaRepository<AutoScheduleSettings, Long> {

    Optional<AutoScheduleSettings> findByUserId(String userId);
}
