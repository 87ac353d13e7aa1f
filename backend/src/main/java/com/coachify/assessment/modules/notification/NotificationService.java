package com.coachify.assessment.modules.notification;

import com.coachify.assessment.modules.assessment.AssessmentPublishedEvent;
import com.coachify.assessment.modules.attempt.AttemptSubmittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Pushes real-time STOMP notifications.
 *
 * Destinations:
 * /topic/batch/{batchId}/assessments → a new assessment is open for the batch
 * /topic/assessment/{assessmentId}/attempts → a student submitted (teachers only)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    @Value("${app.notifications.enabled:true}")
    private boolean enabled;

    public void assessmentPublished(AssessmentPublishedEvent event) {
        if (!enabled) {
            log.debug("Notifications disabled, skipping publish notice for {}", event.assessmentId());
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "ASSESSMENT_PUBLISHED");
        payload.put("assessmentId", event.assessmentId().toString());
        payload.put("coachingId", event.coachingId().toString());
        payload.put("title", event.title());
        payload.put("assessmentType", event.type().name());
        payload.put("questionCount", event.questionCount());
        payload.put("timestamp", clock.instant().toString());

        messagingTemplate.convertAndSend("/topic/batch/" + event.batchId() + "/assessments", payload);
        log.info("Publish notice sent: batch={} assessment={}", event.batchId(), event.assessmentId());
    }

    public void attemptSubmitted(AttemptSubmittedEvent event) {
        if (!enabled) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "ATTEMPT_SUBMITTED");
        payload.put("attemptId", event.attemptId().toString());
        payload.put("userId", event.userId().toString());
        payload.put("totalScore", event.totalScore());
        payload.put("maxScore", event.maxScore());
        payload.put("percentage", event.percentage());
        payload.put("timestamp", clock.instant().toString());

        messagingTemplate.convertAndSend("/topic/assessment/" + event.assessmentId() + "/attempts", payload);
        log.debug("Submission notice sent: assessment={} attempt={}", event.assessmentId(), event.attemptId());
    }
}
