package com.schoolhub.backend.modules.auth.presentation.dto;

public record TeacherProfileResponse(String username, String displayName, String role) {
}
