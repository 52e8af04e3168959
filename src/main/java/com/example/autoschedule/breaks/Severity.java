package com.example.autoschedule.breaks;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Violation severity, also used as suggestion priority. The weight feeds the compliance score.
 */
public enum Severity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3);

    public static final int MAX_WEIGHT = 3;

    private final String code;
    private final int weight;

    Severity(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int weight() {
        return weight;
    }
}
