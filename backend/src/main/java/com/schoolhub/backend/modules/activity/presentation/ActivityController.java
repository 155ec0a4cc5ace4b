package com.schoolhub.backend.modules.activity.presentation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.schoolhub.backend.global.common.MessageResponse;
import com.schoolhub.backend.modules.activity.application.ActivityService;
import com.schoolhub.backend.modules.activity.domain.Activity;
import com.schoolhub.backend.modules.activity.domain.ActivityFilter;
import com.schoolhub.backend.modules.activity.presentation.dto.ActivityResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/activities")
public class ActivityController {

    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @Operation(summary = "List activities", description = "Keyed by activity name, optionally filtered by day and time window.")
    @GetMapping({"", "/"})
    public ResponseEntity<Map<String, ActivityResponse>> getActivities(
            @Parameter(description = "Only activities meeting on this day, e.g. Monday")
            @RequestParam(name = "day", required = false) String day,
            @Parameter(description = "Only activities starting at or after this time (HH:MM)")
            @RequestParam(name = "start_time", required = false) String startTime,
            @Parameter(description = "Only activities ending at or before this time (HH:MM)")
            @RequestParam(name = "end_time", required = false) String endTime
    ) {
        List<Activity> activities = activityService.listActivities(new ActivityFilter(day, startTime, endTime));
        Map<String, ActivityResponse> body = new LinkedHashMap<>();
        for (Activity activity : activities) {
            body.put(activity.getName(), ActivityResponse.from(activity));
        }
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Scheduled days", description = "Every day referenced by an activity, sorted alphabetically.")
    @GetMapping("/days")
    public ResponseEntity<List<String>> getAvailableDays() {
        return ResponseEntity.ok(activityService.getAvailableDays());
    }

    @Operation(summary = "Sign up a student")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Student signed up"),
            @ApiResponse(responseCode = "400", description = "Already signed up"),
            @ApiResponse(responseCode = "401", description = "Teacher authentication missing or invalid"),
            @ApiResponse(responseCode = "404", description = "Activity not found")
    })
    @PostMapping("/{activityName}/signup")
    public ResponseEntity<MessageResponse> signup(
            @PathVariable("activityName") String activityName,
            @RequestParam(name = "email") String email,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername
    ) {
        return ResponseEntity.ok(new MessageResponse(activityService.signup(activityName, email, teacherUsername)));
    }

    @Operation(summary = "Unregister a student")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Student removed"),
            @ApiResponse(responseCode = "400", description = "Not registered"),
            @ApiResponse(responseCode = "401", description = "Teacher authentication missing or invalid"),
            @ApiResponse(responseCode = "404", description = "Activity not found")
    })
    @PostMapping("/{activityName}/unregister")
    public ResponseEntity<MessageResponse> unregister(
            @PathVariable("activityName") String activityName,
            @RequestParam(name = "email") String email,
            @RequestParam(name = "teacher_username", required = false) String teacherUsername
    ) {
        return ResponseEntity.ok(new MessageResponse(activityService.unregister(activityName, email, teacherUsername)));
    }
}
