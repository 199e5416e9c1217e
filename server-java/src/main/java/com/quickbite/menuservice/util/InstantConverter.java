package com.quickbite.menuservice.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * SQLite has no timestamp type; instants are stored as ISO-8601 UTC text.
 */
@Converter(autoApply = true)
public class InstantConverter implements AttributeConverter<Instant, String> {

    private static final DateTimeFormatter LEGACY_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String convertToDatabaseColumn(Instant instant) {
        if (instant == null) {
            return null;
        }
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    @Override
    public Instant convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }

        String value = dbData.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // rows written by hand or by SQLite's datetime(): "yyyy-MM-dd HH:mm:ss", already UTC
            try {
                return LocalDateTime.parse(value, LEGACY_FORMATTER).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                throw new IllegalStateException("Unreadable timestamp in database: " + dbData, e2);
            }
        }
    }
}
