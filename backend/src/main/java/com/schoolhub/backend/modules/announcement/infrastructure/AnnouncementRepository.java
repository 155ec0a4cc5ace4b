package com.schoolhub.backend.modules.announcement.infrastructure;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.schoolhub.backend.modules.announcement.domain.Announcement;

import org.springframework.stereotype.Repository;

/**
 * In-memory announcement board. Owns the id sequence: ids are decimal strings, strictly increasing,
 * never reused until {@link #clear()}.
 */
@Repository
public class AnnouncementRepository {

    private final Map<String, Announcement> announcements = new LinkedHashMap<>();
    private long lastId;

    public synchronized Announcement create(String message, LocalDate startDate, LocalDate endDate,
                                            String createdBy, LocalDateTime createdAt) {
        String id = String.valueOf(++lastId);
        Announcement announcement = new Announcement(id, message, startDate, endDate, createdBy, createdAt);
        announcements.put(id, announcement);
        return announcement;
    }

    public synchronized Optional<Announcement> findById(String id) {
        return Optional.ofNullable(announcements.get(id));
    }

    public synchronized List<Announcement> findAll() {
        return new ArrayList<>(announcements.values());
    }

    public synchronized boolean deleteById(String id) {
        return announcements.remove(id) != null;
    }

    public synchronized int count() {
        return announcements.size();
    }

    public synchronized void clear() {
        announcements.clear();
        lastId = 0;
    }
}
