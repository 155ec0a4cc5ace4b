package com.schoolhub.backend.health;

import com.schoolhub.backend.modules.activity.infrastructure.ActivityRepository;
import com.schoolhub.backend.modules.announcement.infrastructure.AnnouncementRepository;
import com.schoolhub.backend.modules.auth.infrastructure.TeacherRepository;
import com.schoolhub.backend.modules.seed.application.SchoolDataSeeder;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the in-memory store as UP once it has been seeded.
 */
@Component("store")
public class StoreHealthIndicator implements HealthIndicator {

    private final SchoolDataSeeder seeder;
    private final ActivityRepository activityRepository;
    private final AnnouncementRepository announcementRepository;
    private final TeacherRepository teacherRepository;

    public StoreHealthIndicator(
            SchoolDataSeeder seeder,
            ActivityRepository activityRepository,
            AnnouncementRepository announcementRepository,
            TeacherRepository teacherRepository
    ) {
        this.seeder = seeder;
        this.activityRepository = activityRepository;
        this.announcementRepository = announcementRepository;
        this.teacherRepository = teacherRepository;
    }

    @Override
    public Health health() {
        Health.Builder builder = seeder.isSeeded() ? Health.up() : Health.down();
        return builder
                .withDetail("activities", activityRepository.count())
                .withDetail("announcements", announcementRepository.count())
                .withDetail("teachers", teacherRepository.count())
                .build();
    }
}
