package com.schoolhub.backend.modules.announcement.presentation.dto;

public record UpdateAnnouncementRequest(
        String message,
        String startDate,
        String endDate
) {
}
