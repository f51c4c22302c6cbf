package com.behindbars.backend.extraction.dto;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Lenient date reading for model output: ISO dates, or the date part of an ISO date-time.
 */
public final class ExtractionDates {

    private static final int ISO_DATE_LENGTH = 10;

    private ExtractionDates() {
    }

    public static LocalDate parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            if (trimmed.length() > ISO_DATE_LENGTH) {
                try {
                    return LocalDate.parse(trimmed.substring(0, ISO_DATE_LENGTH));
                } catch (DateTimeParseException ignored) {
                    return null;
                }
            }
            return null;
        }
    }
}
