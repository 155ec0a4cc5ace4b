package com.schoolhub.backend.modules.activity.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Weekly schedule of an activity. Times are zero-padded {@code HH:MM} strings, so lexicographic
 * comparison orders them chronologically.
 */
public record ScheduleDetails(Set<String> days, String startTime, String endTime) {

    public ScheduleDetails {
        days = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(days, "days")));
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
    }

    public boolean occursOn(String day) {
        return days.contains(day);
    }

    public boolean startsNotBefore(String time) {
        return startTime.compareTo(time) >= 0;
    }

    public boolean endsNotAfter(String time) {
        return endTime.compareTo(time) <= 0;
    }
}
