package com.coachify.assessment.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the caller's {@link AuthenticatedUser} into the security context. A request
 * without a usable access token carries on anonymously and the route rules in
 * {@code SecurityConfig} decide whether it may proceed.
 */
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String token = JwtTokenProvider.bearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            jwtTokenProvider.resolveAccessToken(token)
                    .ifPresent(user -> SecurityContextHolder.getContext().setAuthentication(user.toAuthentication()));
        }
        filterChain.doFilter(request, response);
    }
}
