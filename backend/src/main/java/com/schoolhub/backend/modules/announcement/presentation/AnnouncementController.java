package com.schoolhub.backend.modules.announcement.presentation;

import java.util.List;

import com.schoolhub.backend.global.common.MessageResponse;
import com.schoolhub.backend.modules.announcement.application.AnnouncementService;
import com.schoolhub.backend.modules.announcement.application.AnnouncementService.AnnouncementChanges;
import com.schoolhub.backend.modules.announcement.application.AnnouncementService.AnnouncementDraft;
import com.schoolhub.backend.modules.announcement.domain.Announcement;
import com.schoolhub.backend.modules.announcement.presentation.dto.AnnouncementResponse;
import com.schoolhub.backend.modules.announcement.presentation.dto.CreateAnnouncementRequest;
import com.schoolhub.backend.modules.announcement.presentation.dto.UpdateAnnouncementRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/announcements")
public class AnnouncementController {

    private final AnnouncementService announcementService;

    public AnnouncementController(AnnouncementService announcementService) {
        this.announcementService = announcementService;
    }

    @Operation(summary = "Active announcements", description = "Announcements whose date window contains today, newest first.")
    @GetMapping({"", "/"})
    public ResponseEntity<List<AnnouncementResponse>> getActiveAnnouncements() {
        return ResponseEntity.ok(toResponses(announcementService.listActive()));
    }

    @Operation(summary = "All announcements", description = "Includes expired and not-yet-started announcements.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "All announcements, newest first"),
            @ApiResponse(responseCode = "401", description = "Teacher authentication missing or invalid")
    })
    @GetMapping("/all")
    public ResponseEntity<List<AnnouncementResponse>> getAllAnnouncements(
            @RequestParam(name = "teacher_username", required = false) String teacherUsername
    ) {
        return ResponseEntity.ok(toResponses(announcementService.listAll(teacherUsername)));
    }

    @Operation(summary = "Create announcement")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Created announcement"),
            @ApiResponse(responseCode = "400", description = "Missing, invalid or out-of-order dates"),
            @ApiResponse(responseCode = "401", description = "Teacher authentication missing or invalid")
    })
    @PostMapping({"", "/"})
    public ResponseEntity<AnnouncementResponse> createAnnouncement(
            @Valid @RequestBody CreateAnnouncementRequest request,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername
    ) {
        AnnouncementDraft draft = new AnnouncementDraft(request.message(), request.startDate(), request.endDate());
        return ResponseEntity.ok(AnnouncementResponse.from(announcementService.create(draft, teacherUsername)));
    }

    @Operation(summary = "Update announcement", description = "Only supplied fields change.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated announcement"),
            @ApiResponse(responseCode = "400", description = "Invalid or out-of-order dates"),
            @ApiResponse(responseCode = "401", description = "Teacher authentication missing or invalid"),
            @ApiResponse(responseCode = "404", description = "Announcement not found")
    })
    @PutMapping("/{announcementId}")
    public ResponseEntity<AnnouncementResponse> updateAnnouncement(
            @PathVariable("announcementId") String announcementId,
            @RequestBody UpdateAnnouncementRequest request,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername
    ) {
        AnnouncementChanges changes = new AnnouncementChanges(request.message(), request.startDate(), request.endDate());
        Announcement updated = announcementService.update(announcementId, changes, teacherUsername);
        return ResponseEntity.ok(AnnouncementResponse.from(updated));
    }

    @Operation(summary = "Delete announcement")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Announcement deleted"),
            @ApiResponse(responseCode = "401", description = "Teacher authentication missing or invalid"),
            @ApiResponse(responseCode = "404", description = "Announcement not found")
    })
    @DeleteMapping("/{announcementId}")
    public ResponseEntity<MessageResponse> deleteAnnouncement(
            @PathVariable("announcementId") String announcementId,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername
    ) {
        announcementService.delete(announcementId, teacherUsername);
        return ResponseEntity.ok(new MessageResponse("Announcement deleted successfully"));
    }

    private static List<AnnouncementResponse> toResponses(List<Announcement> announcements) {
        return announcements.stream()
                .map(AnnouncementResponse::from)
                .toList();
    }
}
