package com.example.autoschedule.breaks;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDateTime;

public record BreakSuggestion(Type type,
                              LocalDateTime suggestedTime,
                              int duration,
                              String reason,
                              Severity priority) {

    public enum Type {
        SHORT_BREAK("short_break"),
        LONG_BREAK("long_break"),
        LUNCH("lunch");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }
}
