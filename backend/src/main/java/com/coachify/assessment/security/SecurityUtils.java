package com.coachify.assessment.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class SecurityUtils {

    public AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        throw new IllegalStateException("No authenticated user found in security context");
    }

    public UUID getCurrentUserId() {
        return getCurrentUser().id();
    }

    /** Teachers and admins review any attempt and always see the answer key. */
    public boolean isStaff() {
        return getCurrentUser().role().isStaff();
    }
}
