package com.schoolhub.backend.modules.auth.domain;

import java.util.Objects;

/**
 * Provisioned teacher account. Immutable once seeded; no endpoint creates or edits teachers.
 */
public final class Teacher {

    public static final String DEFAULT_ROLE = "teacher";

    private final String username;
    private final String passwordHash;
    private final String displayName;
    private final String legacyName;
    private final String role;

    public Teacher(String username, String passwordHash, String displayName, String legacyName, String role) {
        this.username = Objects.requireNonNull(username, "username");
        this.passwordHash = Objects.requireNonNull(passwordHash, "passwordHash");
        this.displayName = displayName;
        this.legacyName = legacyName;
        this.role = role;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    /**
     * Display name, falling back to the legacy {@code name} field and finally to an empty string.
     */
    public String resolveDisplayName() {
        if (displayName != null) {
            return displayName;
        }
        return legacyName != null ? legacyName : "";
    }

    public String resolveRole() {
        return role != null ? role : DEFAULT_ROLE;
    }
}
