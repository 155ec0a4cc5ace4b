package com.schoolhub.backend.modules.announcement;

import static com.schoolhub.backend.support.TestFixtures.teacher;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.announcement.application.AnnouncementService;
import com.schoolhub.backend.modules.announcement.application.AnnouncementService.AnnouncementChanges;
import com.schoolhub.backend.modules.announcement.application.AnnouncementService.AnnouncementDraft;
import com.schoolhub.backend.modules.announcement.domain.Announcement;
import com.schoolhub.backend.modules.announcement.infrastructure.AnnouncementRepository;
import com.schoolhub.backend.modules.auth.application.QueryParameterTeacherAuthenticator;
import com.schoolhub.backend.modules.auth.application.TeacherAuthenticator;
import com.schoolhub.backend.modules.auth.infrastructure.TeacherRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class AnnouncementServiceTest {

    private static final String TEACHER = "mrodriguez";
    private static final LocalDate TODAY = LocalDate.parse("2025-03-10");

    private AnnouncementRepository announcementRepository;
    private TeacherAuthenticator authenticator;
    private Clock clock;
    private AnnouncementService announcementService;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2025-03-10T09:00:00Z"), ZoneOffset.UTC);
        announcementRepository = new AnnouncementRepository();
        TeacherRepository teacherRepository = new TeacherRepository();
        teacherRepository.save(teacher(TEACHER, "hash"));
        authenticator = new QueryParameterTeacherAuthenticator(teacherRepository);
        announcementService = new AnnouncementService(announcementRepository, authenticator, clock);
    }

    @Test
    @DisplayName("first announcement in an empty store gets id 1, later ids increase")
    void idsAreSequential() {
        Announcement first = announcementService.create(draft("Welcome", null, "2025-03-20"), TEACHER);
        Announcement second = announcementService.create(draft("Picture day", null, "2025-03-20"), TEACHER);

        assertThat(first.getId()).isEqualTo("1");
        assertThat(second.getId()).isEqualTo("2");
    }

    @Test
    @DisplayName("ids are not reused after a delete")
    void idsNotReusedAfterDelete() {
        announcementService.create(draft("a", null, "2025-03-20"), TEACHER);
        Announcement second = announcementService.create(draft("b", null, "2025-03-20"), TEACHER);
        announcementService.delete(second.getId(), TEACHER);

        Announcement third = announcementService.create(draft("c", null, "2025-03-20"), TEACHER);
        assertThat(third.getId()).isEqualTo("3");
    }

    @Test
    @DisplayName("create stamps author and creation time")
    void createStampsAuthorAndTime() {
        Announcement created = announcementService.create(draft("Welcome", "2025-03-01", "2025-03-20"), TEACHER);

        assertThat(created.getMessage()).isEqualTo("Welcome");
        assertThat(created.getStartDate()).isEqualTo(LocalDate.parse("2025-03-01"));
        assertThat(created.getEndDate()).isEqualTo(LocalDate.parse("2025-03-20"));
        assertThat(created.getCreatedBy()).isEqualTo(TEACHER);
        assertThat(created.getCreatedAt()).isEqualTo(LocalDateTime.parse("2025-03-10T09:00:00"));
    }

    @Test
    @DisplayName("end date yesterday is rejected, today is accepted")
    void endDateMustNotBeInThePast() {
        assertThatThrownBy(() -> announcementService.create(draft("x", null, TODAY.minusDays(1).toString()), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Expiration date must be in the future"));

        Announcement created = announcementService.create(draft("x", null, TODAY.toString()), TEACHER);
        assertThat(created.getEndDate()).isEqualTo(TODAY);
    }

    @Test
    void endDateIsRequired() {
        assertThatThrownBy(() -> announcementService.create(draft("x", null, null), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Expiration date is required"));
        assertThatThrownBy(() -> announcementService.create(draft("x", null, ""), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Expiration date is required"));
    }

    @Test
    @DisplayName("start date after end date is rejected")
    void startAfterEndRejected() {
        assertThatThrownBy(() -> announcementService.create(draft("x", "2025-03-21", "2025-03-20"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Start date must be before expiration date"));
        assertThat(announcementRepository.count()).isZero();
    }

    @Test
    void unparseableDatesRejected() {
        assertThatThrownBy(() -> announcementService.create(draft("x", null, "20/03/2025"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Invalid date format. Use YYYY-MM-DD"));
        assertThatThrownBy(() -> announcementService.create(draft("x", "soon", "2025-03-20"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Invalid date format. Use YYYY-MM-DD"));
    }

    @Test
    void createRequiresKnownTeacher() {
        assertThatThrownBy(() -> announcementService.create(draft("x", null, "2025-03-20"), null))
                .satisfies(ex -> assertProblem(ex, HttpStatus.UNAUTHORIZED, "Authentication required for this action"));
        assertThatThrownBy(() -> announcementService.create(draft("x", null, "2025-03-20"), "ghost"))
                .satisfies(ex -> assertProblem(ex, HttpStatus.UNAUTHORIZED, "Invalid teacher credentials"));
    }

    @Test
    @DisplayName("active listing drops expired and future announcements, full listing keeps them")
    void activeVersusAllListing() {
        announcementRepository.create("expired", null, TODAY.minusDays(1), TEACHER, LocalDateTime.parse("2025-03-01T08:00:00"));
        announcementRepository.create("current", TODAY.minusDays(2), TODAY.plusDays(2), TEACHER, LocalDateTime.parse("2025-03-02T08:00:00"));
        announcementRepository.create("future", TODAY.plusDays(1), TODAY.plusDays(5), TEACHER, LocalDateTime.parse("2025-03-03T08:00:00"));
        announcementRepository.create("ends today", null, TODAY, TEACHER, LocalDateTime.parse("2025-03-04T08:00:00"));

        assertThat(messages(announcementService.listActive())).containsExactly("ends today", "current");
        assertThat(messages(announcementService.listAll(TEACHER)))
                .containsExactly("ends today", "future", "current", "expired");
    }

    @Test
    void fullListingRequiresTeacher() {
        assertThatThrownBy(() -> announcementService.listAll(null))
                .satisfies(ex -> assertProblem(ex, HttpStatus.UNAUTHORIZED, "Authentication required for this action"));
    }

    @Test
    @DisplayName("listings are ordered newest first by creation time")
    void newestFirst() {
        AnnouncementService later = new AnnouncementService(announcementRepository, authenticator,
                Clock.fixed(Instant.parse("2025-03-10T10:00:00Z"), ZoneOffset.UTC));
        later.create(draft("second", null, "2025-03-20"), TEACHER);
        announcementService.create(draft("first", null, "2025-03-20"), TEACHER);

        assertThat(messages(announcementService.listActive())).containsExactly("second", "first");
    }

    @Test
    @DisplayName("update changes only the supplied fields")
    void partialUpdate() {
        Announcement created = announcementService.create(draft("Welcome", "2025-03-01", "2025-03-20"), TEACHER);

        Announcement updated = announcementService.update(created.getId(), changes("Welcome back", null, null), TEACHER);

        assertThat(updated.getMessage()).isEqualTo("Welcome back");
        assertThat(updated.getStartDate()).isEqualTo(LocalDate.parse("2025-03-01"));
        assertThat(updated.getEndDate()).isEqualTo(LocalDate.parse("2025-03-20"));

        announcementService.update(created.getId(), changes(null, null, "2025-04-01"), TEACHER);
        assertThat(updated.getMessage()).isEqualTo("Welcome back");
        assertThat(updated.getEndDate()).isEqualTo(LocalDate.parse("2025-04-01"));
    }

    @Test
    @DisplayName("new end date before the existing start date is rejected without changes")
    void updateEndBeforeExistingStart() {
        Announcement created = announcementService.create(draft("Welcome", "2025-03-15", "2025-03-20"), TEACHER);

        assertThatThrownBy(() -> announcementService.update(created.getId(), changes("changed", null, "2025-03-14"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Start date must be before expiration date"));
        assertThat(created.getMessage()).isEqualTo("Welcome");
        assertThat(created.getEndDate()).isEqualTo(LocalDate.parse("2025-03-20"));
    }

    @Test
    @DisplayName("new end date is checked against the start date supplied in the same update")
    void updateChecksEndAgainstEffectiveStart() {
        Announcement created = announcementService.create(draft("Welcome", "2025-03-15", "2025-03-20"), TEACHER);

        // old start is after the new end, the new start is not
        Announcement moved = announcementService.update(created.getId(), changes(null, "2025-03-01", "2025-03-05"), TEACHER);
        assertThat(moved.getStartDate()).isEqualTo(LocalDate.parse("2025-03-01"));
        assertThat(moved.getEndDate()).isEqualTo(LocalDate.parse("2025-03-05"));

        assertThatThrownBy(() -> announcementService.update(created.getId(), changes("changed", "2025-03-30", "2025-03-25"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Start date must be before expiration date"));
        assertThat(created.getMessage()).isEqualTo("Welcome");
        assertThat(created.getStartDate()).isEqualTo(LocalDate.parse("2025-03-01"));
        assertThat(created.getEndDate()).isEqualTo(LocalDate.parse("2025-03-05"));
    }

    @Test
    @DisplayName("out of order pair is rejected even when the announcement had no start date")
    void updateRejectsOutOfOrderPairWithoutPreviousStart() {
        Announcement created = announcementService.create(draft("Welcome", null, "2025-03-20"), TEACHER);

        assertThatThrownBy(() -> announcementService.update(created.getId(), changes(null, "2025-04-01", "2025-03-25"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Start date must be before expiration date"));
        assertThat(created.getStartDate()).isNull();
        assertThat(created.getEndDate()).isEqualTo(LocalDate.parse("2025-03-20"));
    }

    @Test
    @DisplayName("empty start date clears the lower bound, null leaves it alone")
    void updateClearsStartDate() {
        Announcement created = announcementService.create(draft("Welcome", "2025-03-15", "2025-03-20"), TEACHER);
        assertThat(announcementService.listActive()).isEmpty();

        announcementService.update(created.getId(), changes("still here", null, null), TEACHER);
        assertThat(created.getStartDate()).isEqualTo(LocalDate.parse("2025-03-15"));

        Announcement cleared = announcementService.update(created.getId(), changes(null, "", null), TEACHER);

        assertThat(cleared.getStartDate()).isNull();
        assertThat(cleared.getEndDate()).isEqualTo(LocalDate.parse("2025-03-20"));
        assertThat(messages(announcementService.listActive())).containsExactly("still here");
    }

    @Test
    @DisplayName("concurrent updates never leave the start date after the end date")
    void concurrentUpdatesKeepWindowOrdered() throws Exception {
        Announcement created = announcementService.create(draft("Welcome", null, "2025-03-20"), TEACHER);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 50; round++) {
                List<Callable<Object>> tasks = new ArrayList<>();
                tasks.add(Executors.callable(() -> updateOrReject(created.getId(), changes(null, "", "2025-04-30"))));
                tasks.add(Executors.callable(() -> updateOrReject(created.getId(), changes(null, "2025-04-01", "2025-04-30"))));
                tasks.add(Executors.callable(() -> updateOrReject(created.getId(), changes(null, null, "2025-03-25"))));
                for (Future<Object> future : executor.invokeAll(tasks)) {
                    future.get();
                }

                LocalDate start = created.getStartDate();
                LocalDate end = created.getEndDate();
                if (start != null) {
                    assertThat(start).isBeforeOrEqualTo(end);
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("update does not require the end date to be in the future")
    void updateAllowsPastEndDate() {
        Announcement created = announcementService.create(draft("Welcome", null, "2025-03-20"), TEACHER);

        Announcement updated = announcementService.update(created.getId(), changes(null, null, "2025-01-01"), TEACHER);

        assertThat(updated.getEndDate()).isEqualTo(LocalDate.parse("2025-01-01"));
        assertThat(announcementService.listActive()).isEmpty();
    }

    @Test
    void updateRejectsBadDatesAndUnknownIds() {
        Announcement created = announcementService.create(draft("Welcome", null, "2025-03-20"), TEACHER);

        assertThatThrownBy(() -> announcementService.update(created.getId(), changes(null, null, "next week"), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Invalid date format. Use YYYY-MM-DD"));
        assertThatThrownBy(() -> announcementService.update(created.getId(), changes(null, "13/13/2025", null), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.BAD_REQUEST, "Invalid date format. Use YYYY-MM-DD"));
        assertThatThrownBy(() -> announcementService.update("99", changes("x", null, null), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.NOT_FOUND, "Announcement not found"));
        assertThatThrownBy(() -> announcementService.update("99", changes("x", null, null), "ghost"))
                .satisfies(ex -> assertProblem(ex, HttpStatus.UNAUTHORIZED, "Invalid teacher credentials"));
    }

    @Test
    void deleteRemovesAnnouncement() {
        Announcement created = announcementService.create(draft("Welcome", null, "2025-03-20"), TEACHER);

        announcementService.delete(created.getId(), TEACHER);

        assertThat(announcementRepository.findById(created.getId())).isEmpty();
        assertThatThrownBy(() -> announcementService.delete(created.getId(), TEACHER))
                .satisfies(ex -> assertProblem(ex, HttpStatus.NOT_FOUND, "Announcement not found"));
    }

    private void updateOrReject(String announcementId, AnnouncementChanges changes) {
        try {
            announcementService.update(announcementId, changes, TEACHER);
        } catch (ProblemException ex) {
            assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }
    }

    private static AnnouncementDraft draft(String message, String startDate, String endDate) {
        return new AnnouncementDraft(message, startDate, endDate);
    }

    private static AnnouncementChanges changes(String message, String startDate, String endDate) {
        return new AnnouncementChanges(message, startDate, endDate);
    }

    private static List<String> messages(List<Announcement> announcements) {
        return announcements.stream().map(Announcement::getMessage).toList();
    }

    private static void assertProblem(Throwable ex, HttpStatus status, String detail) {
        assertThat(ex).isInstanceOf(ProblemException.class);
        ProblemException problem = (ProblemException) ex;
        assertThat(problem.getStatusCode()).isEqualTo(status);
        assertThat(problem.getDetailMessage()).isEqualTo(detail);
    }
}
