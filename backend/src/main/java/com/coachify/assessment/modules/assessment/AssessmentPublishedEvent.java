package com.coachify.assessment.modules.assessment;

import java.util.UUID;

/**
 * Raised inside the transaction that moves an assessment to PUBLISHED.
 * Listeners only see it once that transaction has committed.
 */
public record AssessmentPublishedEvent(UUID assessmentId, UUID coachingId, UUID batchId, String title,
        Assessment.AssessmentType type, long questionCount) {
}
