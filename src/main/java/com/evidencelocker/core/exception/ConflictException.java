package com.evidencelocker.core.exception;

/**
 * Thrown on uniqueness violations (case number, tag name, username) and stale versions.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
