package com.watchwise.backend.common.persistence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Stores a device-local wall clock time as "HH:mm".
 * A malformed stored value is a broken row, not something to guess at.
 */
@Converter(autoApply = false)
public class LocalTimeStringConverter implements AttributeConverter<LocalTime, String> {

    public static final DateTimeFormatter HM = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    @Override
    public String convertToDatabaseColumn(LocalTime t) {
        return t == null ? null : HM.format(t);
    }

    @Override
    public LocalTime convertToEntityAttribute(String s) {
        if (s == null) return null;
        try {
            return LocalTime.parse(s.trim(), HM);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("MALFORMED_STORED_TIME: " + s, e);
        }
    }

    /** Parses client input; null when it is not a valid "HH:mm". */
    public static LocalTime parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalTime.parse(raw.trim(), HM);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
