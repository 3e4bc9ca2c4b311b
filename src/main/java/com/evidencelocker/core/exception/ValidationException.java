package com.evidencelocker.core.exception;

/**
 * Thrown when a required field is missing or malformed.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
