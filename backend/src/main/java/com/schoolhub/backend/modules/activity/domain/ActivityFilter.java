package com.schoolhub.backend.modules.activity.domain;

/**
 * Optional listing filters. A null or empty value disables that filter. Times are compared as
 * strings without validation.
 */
public record ActivityFilter(String day, String startTime, String endTime) {

    public static ActivityFilter none() {
        return new ActivityFilter(null, null, null);
    }

    public boolean matches(Activity activity) {
        ScheduleDetails details = activity.getScheduleDetails();
        if (isSet(day) && !details.occursOn(day)) {
            return false;
        }
        if (isSet(startTime) && !details.startsNotBefore(startTime)) {
            return false;
        }
        return !isSet(endTime) || details.endsNotAfter(endTime);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
