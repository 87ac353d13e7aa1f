package com.coachify.assessment.exception;

public class AttemptsExhaustedException extends RuntimeException {

    public AttemptsExhaustedException(int maxAttempts) {
        super("Maximum attempts reached (" + maxAttempts + ")");
    }
}
