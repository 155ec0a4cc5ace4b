package com.schoolhub.backend.modules.announcement.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record CreateAnnouncementRequest(
        @NotNull(message = "message is required")
        String message,
        String startDate,
        String endDate
) {
}
