package com.example.autoschedule.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stores work days as a JSON array of weekday ordinals, 0 = Sunday .. 6 = Saturday.
 */
@Converter
public class WorkDaysConverter implements AttributeConverter<Set<DayOfWeek>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Integer>> ORDINALS = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Set<DayOfWeek> days) {
        Set<Integer> ordinals = new TreeSet<>();
        if (days != null) {
            days.forEach(day -> ordinals.add(toOrdinal(day)));
        }
        try {
            return MAPPER.writeValueAsString(ordinals);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize work days " + days, e);
        }
    }

    @Override
    public Set<DayOfWeek> convertToEntityAttribute(String json) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (json == null || json.isBlank()) {
            return days;
        }
        try {
            for (Integer ordinal : MAPPER.readValue(json, ORDINALS)) {
                if (ordinal != null) {
                    days.add(fromOrdinal(ordinal));
                }
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed work days column: " + json, e);
        }
        return days;
    }

    public static int toOrdinal(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public static DayOfWeek fromOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal > 6) {
            throw new IllegalArgumentException("Weekday ordinal out of range 0..6: " + ordinal);
        }
        return DayOfWeek.of(ordinal == 0 ? 7 : ordinal);
    }
}
