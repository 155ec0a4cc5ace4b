package com.schoolhub.backend.modules.auth.infrastructure;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.schoolhub.backend.modules.auth.domain.Teacher;

import org.springframework.stereotype.Repository;

/**
 * In-memory credential store keyed by username. Written only by the seeder.
 */
@Repository
public class TeacherRepository {

    private final Map<String, Teacher> teachers = new LinkedHashMap<>();

    public synchronized Optional<Teacher> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(teachers.get(username));
    }

    public synchronized void save(Teacher teacher) {
        teachers.put(teacher.getUsername(), teacher);
    }

    public synchronized int count() {
        return teachers.size();
    }

    public synchronized void clear() {
        teachers.clear();
    }
}
