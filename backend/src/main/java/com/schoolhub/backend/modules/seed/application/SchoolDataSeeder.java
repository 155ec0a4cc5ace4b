package com.schoolhub.backend.modules.seed.application;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.schoolhub.backend.modules.activity.domain.Activity;
import com.schoolhub.backend.modules.activity.domain.ScheduleDetails;
import com.schoolhub.backend.modules.activity.infrastructure.ActivityRepository;
import com.schoolhub.backend.modules.announcement.domain.AnnouncementDates;
import com.schoolhub.backend.modules.announcement.infrastructure.AnnouncementRepository;
import com.schoolhub.backend.modules.auth.domain.Teacher;
import com.schoolhub.backend.modules.auth.infrastructure.TeacherRepository;
import com.schoolhub.backend.modules.seed.application.SchoolSeedDocument.ActivitySeed;
import com.schoolhub.backend.modules.seed.application.SchoolSeedDocument.AnnouncementSeed;
import com.schoolhub.backend.modules.seed.application.SchoolSeedDocument.TeacherSeed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Builds the in-memory store from the seed document at startup. {@link #reset()} wipes all three
 * collections and loads the document again.
 */
@Component
public class SchoolDataSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchoolDataSeeder.class);

    private final ActivityRepository activityRepository;
    private final AnnouncementRepository announcementRepository;
    private final TeacherRepository teacherRepository;
    private final PasswordEncoder passwordEncoder;
    private final ObjectMapper seedMapper;
    private final ResourceLoader resourceLoader;
    private final Clock clock;
    private final boolean enabled;
    private final String location;

    private volatile boolean seeded;

    public SchoolDataSeeder(
            ActivityRepository activityRepository,
            AnnouncementRepository announcementRepository,
            TeacherRepository teacherRepository,
            PasswordEncoder passwordEncoder,
            ObjectMapper objectMapper,
            ResourceLoader resourceLoader,
            Clock clock,
            @Value("${app.seed.enabled:true}") boolean enabled,
            @Value("${app.seed.location:classpath:seed/school-seed.json}") String location
    ) {
        this.activityRepository = activityRepository;
        this.announcementRepository = announcementRepository;
        this.teacherRepository = teacherRepository;
        this.passwordEncoder = passwordEncoder;
        this.seedMapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.resourceLoader = resourceLoader;
        this.clock = clock;
        this.enabled = enabled;
        this.location = location;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Seeding disabled; store starts empty");
            seeded = true;
            return;
        }
        reset();
    }

    public synchronized void reset() {
        clear();
        if (enabled) {
            load(readDocument());
        }
        seeded = true;
    }

    public synchronized void clear() {
        activityRepository.clear();
        announcementRepository.clear();
        teacherRepository.clear();
    }

    public synchronized void load(SchoolSeedDocument document) {
        if (document.teachers() != null) {
            document.teachers().forEach(seed -> teacherRepository.save(toTeacher(seed)));
        }
        if (document.activities() != null) {
            for (Map.Entry<String, ActivitySeed> entry : document.activities().entrySet()) {
                activityRepository.save(toActivity(entry.getKey(), entry.getValue()));
            }
        }
        if (document.announcements() != null) {
            document.announcements().forEach(this::createAnnouncement);
        }
        log.info("Seeded {} activities, {} teachers, {} announcements",
                activityRepository.count(), teacherRepository.count(), announcementRepository.count());
    }

    public boolean isSeeded() {
        return seeded;
    }

    private SchoolSeedDocument readDocument() {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return seedMapper.readValue(in, SchoolSeedDocument.class);
        } catch (IOException ex) {
            log.error("Failed to read seed document {}", location, ex);
            throw new IllegalStateException("Failed to read seed document " + location + ": " + ex.getMessage(), ex);
        }
    }

    private Teacher toTeacher(TeacherSeed seed) {
        String hash = seed.passwordHash();
        if (hash == null) {
            if (seed.password() == null) {
                throw new IllegalStateException("Teacher seed '" + seed.username() + "' has neither password nor password_hash");
            }
            hash = passwordEncoder.encode(seed.password());
        }
        return new Teacher(seed.username(), hash, seed.displayName(), seed.name(), seed.role());
    }

    private Activity toActivity(String name, ActivitySeed seed) {
        if (seed.scheduleDetails() == null) {
            throw new IllegalStateException("Activity seed '" + name + "' has no schedule_details");
        }
        ScheduleDetails details = new ScheduleDetails(
                new LinkedHashSet<>(seed.scheduleDetails().days() != null ? seed.scheduleDetails().days() : List.of()),
                seed.scheduleDetails().startTime(),
                seed.scheduleDetails().endTime()
        );
        return new Activity(name, seed.description(), seed.schedule(), details, seed.maxParticipants(),
                seed.participants());
    }

    private void createAnnouncement(AnnouncementSeed seed) {
        LocalDate today = LocalDate.now(clock);
        LocalDate startDate = seed.startDate() != null ? AnnouncementDates.parse(seed.startDate()) : null;
        LocalDate endDate;
        if (seed.endDate() != null) {
            endDate = AnnouncementDates.parse(seed.endDate());
        } else if (seed.expiresInDays() != null) {
            endDate = today.plusDays(seed.expiresInDays());
        } else {
            throw new IllegalStateException("Announcement seed '" + seed.message() + "' has no end date");
        }
        announcementRepository.create(seed.message(), startDate, endDate, seed.createdBy(), LocalDateTime.now(clock));
    }
}
