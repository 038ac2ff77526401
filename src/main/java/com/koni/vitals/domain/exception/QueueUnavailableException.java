package com.koni.vitals.domain.exception;

/**
 * Exception thrown when a sync window request cannot be published to the message queue.
 */
public class QueueUnavailableException extends RuntimeException {
    
    public QueueUnavailableException(String message) {
        super(message);
    }
    
    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
