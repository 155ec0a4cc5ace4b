package com.schoolhub.backend.modules.announcement.presentation.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.schoolhub.backend.modules.announcement.domain.Announcement;

public record AnnouncementResponse(
        String id,
        String message,
        LocalDate startDate,
        LocalDate endDate,
        String createdBy,
        LocalDateTime createdAt
) {

    public static AnnouncementResponse from(Announcement announcement) {
        return new AnnouncementResponse(
                announcement.getId(),
                announcement.getMessage(),
                announcement.getStartDate(),
                announcement.getEndDate(),
                announcement.getCreatedBy(),
                announcement.getCreatedAt()
        );
    }
}
