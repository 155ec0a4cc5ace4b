package com.schoolhub.backend.modules.seed.application;

import java.util.List;
import java.util.Map;

/**
 * Shape of the seed JSON document (snake_case keys).
 */
public record SchoolSeedDocument(
        Map<String, ActivitySeed> activities,
        List<TeacherSeed> teachers,
        List<AnnouncementSeed> announcements
) {

    public record ActivitySeed(
            String description,
            String schedule,
            ScheduleSeed scheduleDetails,
            Integer maxParticipants,
            List<String> participants
    ) {
    }

    public record ScheduleSeed(List<String> days, String startTime, String endTime) {
    }

    /**
     * Either {@code password} (hashed on load) or a precomputed {@code password_hash}.
     */
    public record TeacherSeed(
            String username,
            String password,
            String passwordHash,
            String displayName,
            String name,
            String role
    ) {
    }

    /**
     * {@code expires_in_days} sets the end date relative to the seeding day when {@code end_date} is absent.
     */
    public record AnnouncementSeed(
            String message,
            String startDate,
            String endDate,
            Integer expiresInDays,
            String createdBy
    ) {
    }
}
