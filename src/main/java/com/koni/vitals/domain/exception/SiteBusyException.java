package com.koni.vitals.domain.exception;

/**
 * Exception thrown when another worker holds the per-site lock.
 * Message consumers rethrow it so the delivery is retried later.
 */
public class SiteBusyException extends RuntimeException {
    
    public SiteBusyException(String message) {
        super(message);
    }
    
    public SiteBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
