package com.schoolhub.backend.global.common;

public record MessageResponse(String message) {
}
