package com.koni.vitals.domain.exception;

/**
 * Exception thrown when a cold storage read or write fails.
 */
public class ColdStorageException extends RuntimeException {
    
    public ColdStorageException(String message) {
        super(message);
    }
    
    public ColdStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
