package com.schoolhub.backend.modules.activity.infrastructure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.schoolhub.backend.modules.activity.domain.Activity;

import org.springframework.stereotype.Repository;

/**
 * In-memory activity directory keyed by activity name, in seed order.
 */
@Repository
public class ActivityRepository {

    private final Map<String, Activity> activities = new LinkedHashMap<>();

    public synchronized List<Activity> findAll() {
        return new ArrayList<>(activities.values());
    }

    public synchronized Optional<Activity> findByName(String name) {
        return Optional.ofNullable(activities.get(name));
    }

    public synchronized void save(Activity activity) {
        activities.put(activity.getName(), activity);
    }

    public synchronized int count() {
        return activities.size();
    }

    public synchronized void clear() {
        activities.clear();
    }
}
