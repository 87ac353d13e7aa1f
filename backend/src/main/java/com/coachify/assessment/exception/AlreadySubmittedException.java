package com.coachify.assessment.exception;

import java.util.UUID;

public class AlreadySubmittedException extends RuntimeException {

    public AlreadySubmittedException(UUID attemptId) {
        super("Attempt already submitted: " + attemptId);
    }
}
