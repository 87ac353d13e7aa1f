package com.coachify.assessment.modules.attempt.dto;

import java.util.UUID;

/** {@code resumed} is true when an existing IN_PROGRESS attempt was returned. */
public record StartAttemptResponse(UUID attemptId, boolean resumed) {
}
