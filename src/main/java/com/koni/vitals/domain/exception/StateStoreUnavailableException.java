package com.koni.vitals.domain.exception;

/**
 * Exception thrown when the durable state store cannot be read or written.
 * This aborts the current invocation, since progress could not be checkpointed.
 */
public class StateStoreUnavailableException extends RuntimeException {
    
    public StateStoreUnavailableException(String message) {
        super(message);
    }
    
    public StateStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
