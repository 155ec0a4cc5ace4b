package com.schoolhub.backend.modules.announcement.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

public final class AnnouncementDates {

    private AnnouncementDates() {
    }

    /**
     * Parses {@code YYYY-MM-DD}; an ISO date-time is also accepted and truncated to its date.
     *
     * @throws DateTimeParseException if neither form matches
     */
    public static LocalDate parse(String raw) {
        String value = raw.trim();
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            if (value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ')) {
                return LocalDateTime.parse(value.substring(0, 10) + "T" + value.substring(11)).toLocalDate();
            }
            throw ex;
        }
    }
}
