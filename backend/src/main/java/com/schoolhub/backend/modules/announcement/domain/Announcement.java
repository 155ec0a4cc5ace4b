package com.schoolhub.backend.modules.announcement.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Time-bounded notice shown between {@code startDate} (optional) and {@code endDate}, both inclusive.
 */
public class Announcement {

    private final String id;
    private final String createdBy;
    private final LocalDateTime createdAt;
    private String message;
    private LocalDate startDate;
    private LocalDate endDate;

    public Announcement(String id, String message, LocalDate startDate, LocalDate endDate,
                        String createdBy, LocalDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.message = message;
        this.startDate = startDate;
        this.endDate = endDate;
        this.createdBy = createdBy;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getId() {
        return id;
    }

    public synchronized String getMessage() {
        return message;
    }

    public synchronized LocalDate getStartDate() {
        return startDate;
    }

    public synchronized LocalDate getEndDate() {
        return endDate;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized boolean isActiveOn(LocalDate date) {
        if (startDate != null && date.isBefore(startDate)) {
            return false;
        }
        return endDate == null || !date.isAfter(endDate);
    }

    /**
     * Applies only the supplied fields; absent fields keep their current value. A supplied end date
     * is compared with the start date the record would have after this patch, and nothing is
     * written when the start would fall after the end.
     *
     * @return false if the patch was rejected
     */
    public synchronized boolean apply(AnnouncementPatch patch) {
        LocalDate effectiveStart = patch.startDate().isPresent()
                ? patch.startDate().get().orElse(null)
                : startDate;
        if (patch.endDate().isPresent() && effectiveStart != null && effectiveStart.isAfter(patch.endDate().get())) {
            return false;
        }
        patch.message().ifPresent(value -> this.message = value);
        patch.startDate().ifPresent(value -> this.startDate = value.orElse(null));
        patch.endDate().ifPresent(value -> this.endDate = value);
        return true;
    }
}
