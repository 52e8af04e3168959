package com.example.autoschedule.breaks;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationType {
    INSUFFICIENT_BREAK("insufficient_break"),
    TOO_LONG_CONTINUOUS("too_long_continuous"),
    NO_LUNCH_BREAK("no_lunch_break");

    private final String code;

    ViolationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
