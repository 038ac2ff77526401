package com.koni.vitals.domain.exception;

/**
 * Exception thrown when the upstream time series API fails in a way that may succeed on retry:
 * network errors, timeouts and 5xx responses.
 */
public class TransientApiException extends RuntimeException {
    
    public TransientApiException(String message) {
        super(message);
    }
    
    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
