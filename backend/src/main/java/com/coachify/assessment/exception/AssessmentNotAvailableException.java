package com.coachify.assessment.exception;

import java.util.UUID;

public class AssessmentNotAvailableException extends RuntimeException {

    public AssessmentNotAvailableException(UUID assessmentId) {
        super("Assessment is not available: " + assessmentId);
    }
}
