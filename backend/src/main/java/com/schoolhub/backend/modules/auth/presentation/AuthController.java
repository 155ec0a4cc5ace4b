package com.schoolhub.backend.modules.auth.presentation;

import com.schoolhub.backend.modules.auth.application.AuthService;
import com.schoolhub.backend.modules.auth.presentation.dto.TeacherProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Teacher login", description = "Verifies the password against the stored salted hash.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Teacher profile"),
            @ApiResponse(responseCode = "401", description = "Invalid username or password")
    })
    @PostMapping("/login")
    public ResponseEntity<TeacherProfileResponse> login(
            @RequestParam(name = "username") String username,
            @RequestParam(name = "password") String password
    ) {
        return ResponseEntity.ok(authService.login(username, password));
    }

    @Operation(summary = "Check session", description = "Returns the profile of an existing username without checking a password.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Teacher profile"),
            @ApiResponse(responseCode = "404", description = "Teacher not found")
    })
    @GetMapping("/check-session")
    public ResponseEntity<TeacherProfileResponse> checkSession(@RequestParam(name = "username") String username) {
        return ResponseEntity.ok(authService.checkSession(username));
    }
}
