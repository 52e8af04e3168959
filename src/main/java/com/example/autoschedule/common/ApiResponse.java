package com.example.autoschedule.common;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope for every endpoint: clients check {@code success} and read {@code data}.
 * {@code meta} carries run-level figures such as counts or the evaluated day range.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
