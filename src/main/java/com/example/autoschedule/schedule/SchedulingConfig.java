package com.example.autoschedule.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class SchedulingConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * カレンダー連携が無い場合は予定なしとして扱う
     */
    @Bean
    @ConditionalOnMissingBean
    public BusyIntervalProvider busyIntervalProvider() {
        logger.info("No calendar integration configured, scheduling without busy intervals");
        return (userId, from, to) -> List.of();
    }
}
