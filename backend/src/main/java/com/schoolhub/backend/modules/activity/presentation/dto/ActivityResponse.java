package com.schoolhub.backend.modules.activity.presentation.dto;

import java.util.List;

import com.schoolhub.backend.modules.activity.domain.Activity;

public record ActivityResponse(
        String description,
        String schedule,
        ScheduleDetailsResponse scheduleDetails,
        Integer maxParticipants,
        List<String> participants
) {

    public static ActivityResponse from(Activity activity) {
        return new ActivityResponse(
                activity.getDescription(),
                activity.getSchedule(),
                new ScheduleDetailsResponse(
                        List.copyOf(activity.getScheduleDetails().days()),
                        activity.getScheduleDetails().startTime(),
                        activity.getScheduleDetails().endTime()
                ),
                activity.getMaxParticipants(),
                activity.getParticipants()
        );
    }
}
