package com.coachify.assessment.modules.attempt;

import java.util.UUID;

public record AttemptSubmittedEvent(UUID attemptId, UUID assessmentId, UUID userId, double totalScore,
        double maxScore, double percentage) {
}
