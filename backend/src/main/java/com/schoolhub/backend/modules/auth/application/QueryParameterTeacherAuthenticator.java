package com.schoolhub.backend.modules.auth.application;

import com.schoolhub.backend.global.error.ProblemException;
import com.schoolhub.backend.modules.auth.domain.Teacher;
import com.schoolhub.backend.modules.auth.infrastructure.TeacherRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Treats the plain {@code teacher_username} query parameter as the credential: any known username
 * is accepted, no secret is checked. Kept for compatibility with existing clients.
 */
@Component
public class QueryParameterTeacherAuthenticator implements TeacherAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(QueryParameterTeacherAuthenticator.class);

    private final TeacherRepository teacherRepository;

    public QueryParameterTeacherAuthenticator(TeacherRepository teacherRepository) {
        this.teacherRepository = teacherRepository;
    }

    @Override
    public Teacher requireTeacher(String teacherUsername) {
        if (teacherUsername == null || teacherUsername.isEmpty()) {
            throw ProblemException.unauthorized("auth.required", "Authentication required for this action");
        }
        return teacherRepository.findByUsername(teacherUsername)
                .orElseThrow(() -> {
                    log.warn("Rejected teacher-only request for unknown teacher '{}'", teacherUsername);
                    return ProblemException.unauthorized("auth.invalid_teacher", "Invalid teacher credentials");
                });
    }
}
