package com.schoolhub.backend.modules.activity.application;

import java.util.List;
import java.util.TreeSet;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.activity.domain.Activity;
import com.schoolhub.backend.modules.activity.domain.ActivityFilter;
import com.schoolhub.backend.modules.activity.infrastructure.ActivityRepository;
import com.schoolhub.backend.modules.auth.application.TeacherAuthenticator;
import com.schoolhub.backend.modules.auth.domain.Teacher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);

    private final ActivityRepository activityRepository;
    private final TeacherAuthenticator teacherAuthenticator;

    public ActivityService(ActivityRepository activityRepository, TeacherAuthenticator teacherAuthenticator) {
        this.activityRepository = activityRepository;
        this.teacherAuthenticator = teacherAuthenticator;
    }

    public List<Activity> listActivities(ActivityFilter filter) {
        return activityRepository.findAll().stream()
                .filter(filter::matches)
                .toList();
    }

    /**
     * Distinct scheduled days in alphabetical (not calendar) order.
     */
    public List<String> getAvailableDays() {
        TreeSet<String> days = new TreeSet<>();
        for (Activity activity : activityRepository.findAll()) {
            days.addAll(activity.getScheduleDetails().days());
        }
        return List.copyOf(days);
    }

    public String signup(String activityName, String email, String teacherUsername) {
        Teacher teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        Activity activity = loadActivity(activityName);

        if (!activity.addParticipant(email)) {
            throw ProblemException.badRequest("activity.already_signed_up", "Already signed up for this activity");
        }

        log.info("Teacher '{}' signed up {} for {}", teacher.getUsername(), email, activityName);
        return "Signed up " + email + " for " + activityName;
    }

    public String unregister(String activityName, String email, String teacherUsername) {
        Teacher teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        Activity activity = loadActivity(activityName);

        if (!activity.removeParticipant(email)) {
            throw ProblemException.badRequest("activity.not_registered", "Not registered for this activity");
        }

        log.info("Teacher '{}' unregistered {} from {}", teacher.getUsername(), email, activityName);
        return "Unregistered " + email + " from " + activityName;
    }

    private Activity loadActivity(String activityName) {
        return activityRepository.findByName(activityName)
                .orElseThrow(() -> ProblemException.notFound("activity.not_found", "Activity not found"));
    }
}
