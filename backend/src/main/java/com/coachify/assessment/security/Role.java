package com.coachify.assessment.security;

public enum Role {
    STUDENT,
    TEACHER,
    ADMIN;

    /** Teachers and admins author assessments and review every attempt. */
    public boolean isStaff() {
        return this == TEACHER || this == ADMIN;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public static String[] staffRoles() {
        return new String[] { TEACHER.name(), ADMIN.name() };
    }
}
