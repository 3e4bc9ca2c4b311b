package com.evidencelocker.core.exception;

/**
 * Thrown when a request carries no credential that resolves to a known principal.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
