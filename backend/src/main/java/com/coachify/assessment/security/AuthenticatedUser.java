package com.coachify.assessment.security;

import io.jsonwebtoken.Claims;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.UUID;

/**
 * Principal for both REST and STOMP sessions. The id is the user's UUID from
 * the token subject.
 */
public record AuthenticatedUser(UUID id, String email, Role role) {

    /**
     * @throws IllegalArgumentException when the subject is not a UUID or the
     *                                  role claim is missing or unknown
     */
    static AuthenticatedUser fromClaims(Claims claims) {
        String role = claims.get("role", String.class);
        if (role == null) {
            throw new IllegalArgumentException("Token has no role claim");
        }
        return new AuthenticatedUser(UUID.fromString(claims.getSubject()), claims.get("email", String.class),
                Role.valueOf(role));
    }

    public UsernamePasswordAuthenticationToken toAuthentication() {
        return new UsernamePasswordAuthenticationToken(this, null, List.of(new SimpleGrantedAuthority(role.authority())));
    }
}
