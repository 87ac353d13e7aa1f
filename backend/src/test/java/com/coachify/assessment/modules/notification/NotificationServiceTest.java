package com.coachify.assessment.modules.notification;

import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.assessment.AssessmentPublishedEvent;
import com.coachify.assessment.modules.attempt.AttemptSubmittedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService")
class NotificationServiceTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(messagingTemplate,
                Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(notificationService, "enabled", true);
    }

    @Test
    @DisplayName("published assessment goes to the batch topic")
    @SuppressWarnings("unchecked")
    void assessmentPublished_batchTopic() {
        UUID batchId = UUID.randomUUID();
        AssessmentPublishedEvent event = new AssessmentPublishedEvent(UUID.randomUUID(), UUID.randomUUID(), batchId,
                "Trigonometry", Assessment.AssessmentType.TEST, 10);

        notificationService.assessmentPublished(event);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/batch/" + batchId + "/assessments"), payload.capture());
        Map<String, Object> body = (Map<String, Object>) payload.getValue();
        assertThat(body).containsEntry("type", "ASSESSMENT_PUBLISHED")
                .containsEntry("title", "Trigonometry")
                .containsEntry("questionCount", 10L)
                .containsEntry("timestamp", "2026-03-01T09:00:00Z");
    }

    @Test
    @DisplayName("submitted attempt goes to the assessment topic")
    void attemptSubmitted_assessmentTopic() {
        UUID assessmentId = UUID.randomUUID();
        notificationService.attemptSubmitted(new AttemptSubmittedEvent(UUID.randomUUID(), assessmentId,
                UUID.randomUUID(), 3, 4, 75));

        verify(messagingTemplate).convertAndSend(eq("/topic/assessment/" + assessmentId + "/attempts"), any(Object.class));
    }

    @Test
    @DisplayName("nothing is sent when notifications are disabled")
    void disabled_sendsNothing() {
        ReflectionTestUtils.setField(notificationService, "enabled", false);

        notificationService.assessmentPublished(new AssessmentPublishedEvent(UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), "Off", Assessment.AssessmentType.QUIZ, 1));

        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }
}
