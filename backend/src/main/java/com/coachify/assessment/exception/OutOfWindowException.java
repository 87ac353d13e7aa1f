package com.coachify.assessment.exception;

public class OutOfWindowException extends RuntimeException {

    public OutOfWindowException(String message) {
        super(message);
    }
}
