package com.schoolhub.backend.modules.announcement.domain;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Partial update where each field is either supplied or left untouched. A supplied start date may
 * be empty, which removes the visibility lower bound.
 */
public record AnnouncementPatch(
        Optional<String> message,
        Optional<Optional<LocalDate>> startDate,
        Optional<LocalDate> endDate
) {

    public AnnouncementPatch {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
    }
}
