package com.koni.vitals.domain.exception;

/**
 * Exception thrown when an operation names a site that is not in the site registry.
 */
public class UnknownSiteException extends RuntimeException {
    
    public UnknownSiteException(String message) {
        super(message);
    }
    
    public UnknownSiteException(String message, Throwable cause) {
        super(message, cause);
    }
}
