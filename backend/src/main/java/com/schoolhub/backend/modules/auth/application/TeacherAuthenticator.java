package com.schoolhub.backend.modules.auth.application;

import com.schoolhub.backend.modules.auth.domain.Teacher;

/**
 * Authorizes teacher-only mutations. Implementations throw a 401 {@code ProblemException}
 * when the credential is missing or unknown.
 */
public interface TeacherAuthenticator {

    Teacher requireTeacher(String teacherUsername);
}
