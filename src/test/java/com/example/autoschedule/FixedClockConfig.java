package com.example.autoschedule;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Monday 2025-03-03 08:00 UTC, before the default work day starts.
 */
@TestConfiguration
public class FixedClockConfig {

    public static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 3, 8, 0);

    @Bean
    @Primary
    public Clock fixedClock() {
        Instant instant = NOW.toInstant(ZoneOffset.UTC);
        return Clock.fixed(instant, ZoneOffset.UTC);
    }
}
