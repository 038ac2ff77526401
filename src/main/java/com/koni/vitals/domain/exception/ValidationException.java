package com.koni.vitals.domain.exception;

/**
 * Exception thrown when a request or domain value fails validation.
 * Surfaced to HTTP callers as 400 Bad Request and never retried.
 */
public class ValidationException extends RuntimeException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
