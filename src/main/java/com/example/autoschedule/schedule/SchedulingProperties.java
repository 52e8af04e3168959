package com.example.autoschedule.schedule;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

/**
 * Tunables of the engine and of the lunch rule, read from {@code autoschedule.*}.
 */
@Component
public class SchedulingProperties {

    private final int slotGranularityMinutes;
    private final int horizonDays;
    private final LocalTime lunchWindowStart;
    private final LocalTime lunchWindowEnd;
    private final int lunchMinGapMinutes;

    public SchedulingProperties(@Value("${autoschedule.engine.slot-granularity-minutes:15}") int slotGranularityMinutes,
                                @Value("${autoschedule.engine.horizon-days:14}") int horizonDays,
                                @Value("${autoschedule.lunch.window-start:11:30}") String lunchWindowStart,
                                @Value("${autoschedule.lunch.window-end:13:30}") String lunchWindowEnd,
                                @Value("${autoschedule.lunch.min-gap-minutes:30}") int lunchMinGapMinutes) {
        if (slotGranularityMinutes < 1 || slotGranularityMinutes > 60) {
            throw new IllegalArgumentException("slot-granularity-minutes must be within 1..60: " + slotGranularityMinutes);
        }
        if (horizonDays < 1) {
            throw new IllegalArgumentException("horizon-days must be positive: " + horizonDays);
        }
        this.slotGranularityMinutes = slotGranularityMinutes;
        this.horizonDays = horizonDays;
        this.lunchWindowStart = LocalTime.parse(lunchWindowStart);
        this.lunchWindowEnd = LocalTime.parse(lunchWindowEnd);
        this.lunchMinGapMinutes = lunchMinGapMinutes;
        if (!this.lunchWindowStart.isBefore(this.lunchWindowEnd)) {
            throw new IllegalArgumentException("lunch window start must be before its end");
        }
    }

    public static SchedulingProperties defaults() {
        return new SchedulingProperties(15, 14, "11:30", "13:30", 30);
    }

    public int getSlotGranularityMinutes() {
        return slotGranularityMinutes;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    public LocalTime getLunchWindowStart() {
        return lunchWindowStart;
    }

    public LocalTime getLunchWindowEnd() {
        return lunchWindowEnd;
    }

    public int getLunchMinGapMinutes() {
        return lunchMinGapMinutes;
    }
}
