package com.coachify.assessment.exception;

/**
 * Request is well-formed but breaks a domain rule. Mapped to 400 unless a more
 * specific subclass has its own handler.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
