package com.coachify.assessment.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Validates access tokens issued by the platform's auth service. This service
 * never issues tokens itself; it only needs the shared signing secret.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private static final String ACCESS_TOKEN_TYPE = "ACCESS";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey signingKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Maps a signed, unexpired ACCESS token to its principal. Refresh tokens,
     * bad signatures and tokens with unusable claims resolve to empty.
     */
    public Optional<AuthenticatedUser> resolveAccessToken(String token) {
        Optional<Claims> parsed = parse(token);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        Claims claims = parsed.get();
        String type = claims.get("type", String.class);
        if (!ACCESS_TOKEN_TYPE.equals(type)) {
            log.debug("Rejected {} token presented as an access token", type);
            return Optional.empty();
        }
        try {
            return Optional.of(AuthenticatedUser.fromClaims(claims));
        } catch (IllegalArgumentException e) {
            log.debug("Access token carries unusable claims: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Token part of an {@code Authorization: Bearer ...} header, or null. */
    public static String bearerToken(String authorizationHeader) {
        if (StringUtils.hasText(authorizationHeader) && authorizationHeader.startsWith(BEARER_PREFIX)) {
            return authorizationHeader.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    private Optional<Claims> parse(String token) {
        try {
            return Optional.of(Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .build()
                    .parseClaimsJws(token)
                    .getBody());
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT token: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
