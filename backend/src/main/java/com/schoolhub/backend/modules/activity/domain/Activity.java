package com.schoolhub.backend.modules.activity.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracurricular activity keyed by its name. Participant emails are unique within one activity;
 * the list is guarded by the activity's own monitor.
 */
public class Activity {

    private final String name;
    private final String description;
    private final String schedule;
    private final ScheduleDetails scheduleDetails;
    private final Integer maxParticipants;
    private final List<String> participants;

    public Activity(String name, String description, String schedule, ScheduleDetails scheduleDetails,
                    Integer maxParticipants, List<String> participants) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.schedule = schedule;
        this.scheduleDetails = Objects.requireNonNull(scheduleDetails, "scheduleDetails");
        this.maxParticipants = maxParticipants;
        this.participants = new ArrayList<>();
        if (participants != null) {
            participants.forEach(this::addParticipant);
        }
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getSchedule() {
        return schedule;
    }

    public ScheduleDetails getScheduleDetails() {
        return scheduleDetails;
    }

    public Integer getMaxParticipants() {
        return maxParticipants;
    }

    public synchronized List<String> getParticipants() {
        return List.copyOf(participants);
    }

    /**
     * @return false if the email is already signed up
     */
    public synchronized boolean addParticipant(String email) {
        if (participants.contains(email)) {
            return false;
        }
        participants.add(email);
        return true;
    }

    /**
     * @return false if the email was not signed up
     */
    public synchronized boolean removeParticipant(String email) {
        return participants.remove(email);
    }
}
