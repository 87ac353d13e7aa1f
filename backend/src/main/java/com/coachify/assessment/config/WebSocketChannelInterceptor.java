package com.coachify.assessment.config;

import com.coachify.assessment.security.AuthenticatedUser;
import com.coachify.assessment.security.JwtTokenProvider;
import com.coachify.assessment.security.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * Authenticates STOMP CONNECT frames with the same access token as the REST
 * API and restricts SUBSCRIBE frames:
 * /topic/batch/{batchId}/assessments - any authenticated user
 * /topic/assessment/{assessmentId}/attempts - TEACHER or ADMIN only
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketChannelInterceptor implements ChannelInterceptor {

    private static final String LEADERBOARD_PREFIX = "/topic/assessment/";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null)
            return message;

        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            handleConnect(accessor);
        } else if (StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
            handleSubscribe(accessor);
        }
        return message;
    }

    private void handleConnect(StompHeaderAccessor accessor) {
        String token = JwtTokenProvider.bearerToken(accessor.getFirstNativeHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            log.warn("WebSocket CONNECT rejected: no Authorization header");
            throw new IllegalArgumentException("Missing JWT token in WebSocket CONNECT");
        }
        AuthenticatedUser user = jwtTokenProvider.resolveAccessToken(token).orElseThrow(() -> {
            log.warn("WebSocket CONNECT rejected: invalid or expired access token");
            return new IllegalArgumentException("Invalid or expired JWT token");
        });
        accessor.setUser(user.toAuthentication());
        log.debug("WebSocket CONNECT authenticated user {}", user.id());
    }

    private void handleSubscribe(StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        if (destination == null || !destination.startsWith(LEADERBOARD_PREFIX)) {
            return;
        }
        Role role = roleOf(accessor.getUser());
        if (role == null || !role.isStaff()) {
            log.warn("WebSocket SUBSCRIBE to {} rejected for role {}", destination, role);
            throw new IllegalArgumentException("Not allowed to subscribe to " + destination);
        }
    }

    private Role roleOf(Principal principal) {
        if (principal instanceof UsernamePasswordAuthenticationToken auth
                && auth.getPrincipal() instanceof AuthenticatedUser user) {
            return user.role();
        }
        return null;
    }
}
