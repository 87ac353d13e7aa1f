package com.coachify.assessment.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtAuthenticationFilter")
class JwtAuthenticationFilterTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-test-secret-0123456789";

    private final JwtTokenProvider tokenProvider = new JwtTokenProvider(SECRET);
    private final JwtAuthenticationFilter filter = new JwtAuthenticationFilter(tokenProvider);

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("valid access token populates the security context")
    void accessToken_authenticates() throws Exception {
        String userId = UUID.randomUUID().toString();
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer " + token(userId, "STUDENT", "ACCESS", 60_000));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(auth.getPrincipal()).isInstanceOf(AuthenticatedUser.class);
        AuthenticatedUser user = (AuthenticatedUser) auth.getPrincipal();
        assertThat(user.id()).isEqualTo(UUID.fromString(userId));
        assertThat(user.role()).isEqualTo(Role.STUDENT);
        assertThat(auth.getAuthorities()).extracting(GrantedAuthority::getAuthority).containsExactly("ROLE_STUDENT");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("refresh tokens are not accepted as bearer tokens")
    void refreshToken_ignored() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer " + token(UUID.randomUUID().toString(), "STUDENT", "REFRESH",
                60_000));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("expired or malformed tokens leave the request anonymous")
    void invalidTokens_ignored() throws Exception {
        assertThat(tokenProvider.resolveAccessToken(token(UUID.randomUUID().toString(), "TEACHER", "ACCESS", -1_000)))
                .isEmpty();
        assertThat(tokenProvider.resolveAccessToken("not-a-jwt")).isEmpty();

        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer not-a-jwt");
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("tokens with an unknown role or a non-UUID subject are not accepted")
    void unusableClaims_ignored() throws Exception {
        assertThat(tokenProvider.resolveAccessToken(token(UUID.randomUUID().toString(), "PARENT", "ACCESS", 60_000)))
                .isEmpty();
        assertThat(tokenProvider.resolveAccessToken(token("not-a-uuid", "STUDENT", "ACCESS", 60_000))).isEmpty();

        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer " + token(UUID.randomUUID().toString(), "PARENT", "ACCESS", 60_000));
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    private static String token(String subject, String role, String type, long ttlMillis) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setSubject(subject)
                .claim("role", role)
                .claim("email", "user@example.com")
                .claim("type", type)
                .setIssuedAt(new Date(now - 5_000))
                .setExpiration(new Date(now + ttlMillis))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
