package com.watchwise.backend.common.persistence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/** ISO day numbers, comma separated: MONDAY..SUNDAY -> "1,...,7". */
@Converter(autoApply = false)
public class DayOfWeekSetConverter implements AttributeConverter<Set<DayOfWeek>, String> {

    @Override
    public String convertToDatabaseColumn(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) return "";
        return EnumSet.copyOf(days).stream()
                .map(d -> String.valueOf(d.getValue()))
                .collect(Collectors.joining(","));
    }

    @Override
    public Set<DayOfWeek> convertToEntityAttribute(String s) {
        EnumSet<DayOfWeek> out = EnumSet.noneOf(DayOfWeek.class);
        if (s == null || s.isBlank()) return out;
        for (String part : s.split(",")) {
            try {
                out.add(DayOfWeek.of(Integer.parseInt(part.trim())));
            } catch (RuntimeException e) {
                throw new IllegalStateException("MALFORMED_STORED_DAYS: " + s, e);
            }
        }
        return out;
    }
}
