package com.schoolhub.backend.modules.auth.application;

import java.util.Optional;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.auth.domain.Teacher;
import com.schoolhub.backend.modules.auth.infrastructure.TeacherRepository;
import com.schoolhub.backend.modules.auth.presentation.dto.TeacherProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final TeacherRepository teacherRepository;
    private final PasswordEncoder passwordEncoder;
    // matched against when the username is unknown so both failure paths cost one hash check
    private final String unknownUserHash;

    public AuthService(TeacherRepository teacherRepository, PasswordEncoder passwordEncoder) {
        this.teacherRepository = teacherRepository;
        this.passwordEncoder = passwordEncoder;
        this.unknownUserHash = passwordEncoder.encode("unknown-user-placeholder");
    }

    public TeacherProfileResponse login(String username, String password) {
        Optional<Teacher> teacher = teacherRepository.findByUsername(username);
        String hash = teacher.map(Teacher::getPasswordHash).orElse(unknownUserHash);
        boolean matches = passwordEncoder.matches(password, hash);

        if (teacher.isEmpty() || !matches) {
            log.warn("Failed login attempt for username '{}'", username);
            throw ProblemException.unauthorized("auth.invalid_credentials", "Invalid username or password");
        }

        log.info("Teacher '{}' logged in", username);
        return toProfile(teacher.get());
    }

    /**
     * Confirms that the username exists. No secret is checked.
     */
    public TeacherProfileResponse checkSession(String username) {
        Teacher teacher = teacherRepository.findByUsername(username)
                .orElseThrow(() -> ProblemException.notFound("auth.teacher_not_found", "Teacher not found"));
        return toProfile(teacher);
    }

    private TeacherProfileResponse toProfile(Teacher teacher) {
        return new TeacherProfileResponse(
                teacher.getUsername(),
                teacher.resolveDisplayName(),
                teacher.resolveRole()
        );
    }
}
