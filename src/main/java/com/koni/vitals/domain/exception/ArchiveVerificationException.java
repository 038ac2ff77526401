package com.koni.vitals.domain.exception;

/**
 * Exception thrown when an uploaded archive object cannot be confirmed in cold storage.
 * The partition's hot rows must stay in place when this is raised.
 */
public class ArchiveVerificationException extends RuntimeException {
    
    public ArchiveVerificationException(String message) {
        super(message);
    }
    
    public ArchiveVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
