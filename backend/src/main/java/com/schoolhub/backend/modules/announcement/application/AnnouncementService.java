package com.schoolhub.backend.modules.announcement.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.announcement.domain.Announcement;
import com.schoolhub.backend.modules.announcement.domain.AnnouncementDates;
import com.schoolhub.backend.modules.announcement.domain.AnnouncementPatch;
import com.schoolhub.backend.modules.announcement.infrastructure.AnnouncementRepository;
import com.schoolhub.backend.modules.auth.application.TeacherAuthenticator;
import com.schoolhub.backend.modules.auth.domain.Teacher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnnouncementService {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementService.class);

    private static final Comparator<Announcement> NEWEST_FIRST =
            Comparator.comparing(Announcement::getCreatedAt).reversed();

    private final AnnouncementRepository announcementRepository;
    private final TeacherAuthenticator teacherAuthenticator;
    private final Clock clock;

    public AnnouncementService(
            AnnouncementRepository announcementRepository,
            TeacherAuthenticator teacherAuthenticator,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.teacherAuthenticator = teacherAuthenticator;
        this.clock = clock;
    }

    /**
     * Announcements whose window contains today, newest first. Public.
     */
    public List<Announcement> listActive() {
        LocalDate today = LocalDate.now(clock);
        return announcementRepository.findAll().stream()
                .filter(announcement -> announcement.isActiveOn(today))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public List<Announcement> listAll(String teacherUsername) {
        teacherAuthenticator.requireTeacher(teacherUsername);
        return announcementRepository.findAll().stream()
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public Announcement create(AnnouncementDraft draft, String teacherUsername) {
        Teacher teacher = teacherAuthenticator.requireTeacher(teacherUsername);

        if (draft.endDate() == null || draft.endDate().isEmpty()) {
            throw ProblemException.badRequest("announcement.end_date_required", "Expiration date is required");
        }

        LocalDate endDate = parseDate(draft.endDate());
        if (endDate.isBefore(LocalDate.now(clock))) {
            throw ProblemException.badRequest("announcement.end_date_past", "Expiration date must be in the future");
        }

        LocalDate startDate = null;
        if (draft.startDate() != null && !draft.startDate().isEmpty()) {
            startDate = parseDate(draft.startDate());
            if (startDate.isAfter(endDate)) {
                throw startAfterEnd();
            }
        }

        Announcement created = announcementRepository.create(
                draft.message(),
                startDate,
                endDate,
                teacher.getUsername(),
                LocalDateTime.now(clock)
        );
        log.info("Teacher '{}' created announcement {} (window {} .. {})",
                teacher.getUsername(), created.getId(), startDate, endDate);
        return created;
    }

    /**
     * Applies the supplied fields. A new end date must not precede the start date the announcement
     * ends up with; an empty start date clears it.
     */
    public Announcement update(String announcementId, AnnouncementChanges changes, String teacherUsername) {
        Teacher teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        Announcement announcement = loadAnnouncement(announcementId);

        Optional<Optional<LocalDate>> startDate = Optional.ofNullable(changes.startDate())
                .map(raw -> raw.isEmpty() ? Optional.<LocalDate>empty() : Optional.of(parseDate(raw)));
        Optional<LocalDate> endDate = Optional.ofNullable(changes.endDate()).map(this::parseDate);

        AnnouncementPatch patch = new AnnouncementPatch(Optional.ofNullable(changes.message()), startDate, endDate);
        if (!announcement.apply(patch)) {
            throw startAfterEnd();
        }
        log.info("Teacher '{}' updated announcement {}", teacher.getUsername(), announcementId);
        return announcement;
    }

    public void delete(String announcementId, String teacherUsername) {
        Teacher teacher = teacherAuthenticator.requireTeacher(teacherUsername);
        if (!announcementRepository.deleteById(announcementId)) {
            throw notFound();
        }
        log.info("Teacher '{}' deleted announcement {}", teacher.getUsername(), announcementId);
    }

    private Announcement loadAnnouncement(String announcementId) {
        return announcementRepository.findById(announcementId).orElseThrow(AnnouncementService::notFound);
    }

    private LocalDate parseDate(String raw) {
        try {
            return AnnouncementDates.parse(raw);
        } catch (DateTimeParseException ex) {
            throw ProblemException.badRequest("announcement.invalid_date", "Invalid date format. Use YYYY-MM-DD");
        }
    }

    private static ProblemException startAfterEnd() {
        return ProblemException.badRequest("announcement.start_after_end", "Start date must be before expiration date");
    }

    private static ProblemException notFound() {
        return ProblemException.notFound("announcement.not_found", "Announcement not found");
    }

    public record AnnouncementDraft(String message, String startDate, String endDate) {
    }

    /**
     * Raw update input; a null field was not supplied, an empty start date clears it.
     */
    public record AnnouncementChanges(String message, String startDate, String endDate) {
    }
}
