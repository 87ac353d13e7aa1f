package com.coachify.assessment.modules.notification;

import com.coachify.assessment.config.AsyncConfig;
import com.coachify.assessment.modules.assessment.AssessmentPublishedEvent;
import com.coachify.assessment.modules.attempt.AttemptSubmittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Relays domain events to {@link NotificationService} once the originating
 * transaction has committed. Delivery failures are logged and dropped; they
 * never reach the request that raised the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssessmentNotificationListener {

    private final NotificationService notificationService;

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAssessmentPublished(AssessmentPublishedEvent event) {
        try {
            notificationService.assessmentPublished(event);
        } catch (Exception e) {
            log.warn("Failed to notify batch {} about assessment {}: {}", event.batchId(), event.assessmentId(),
                    e.getMessage());
        }
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAttemptSubmitted(AttemptSubmittedEvent event) {
        try {
            notificationService.attemptSubmitted(event);
        } catch (Exception e) {
            log.warn("Failed to notify submission of attempt {}: {}", event.attemptId(), e.getMessage());
        }
    }
}
