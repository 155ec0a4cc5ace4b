package com.schoolhub.backend.modules.activity.presentation.dto;

import java.util.List;

public record ScheduleDetailsResponse(List<String> days, String startTime, String endTime) {
}
