package com.coachify.assessment.exception;

/** Malformed answer payload, or one whose kind does not match the question type. */
public class InvalidAnswerException extends BusinessException {

    public InvalidAnswerException(String message) {
        super(message);
    }
}
