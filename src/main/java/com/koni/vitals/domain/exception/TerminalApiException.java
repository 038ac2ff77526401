package com.koni.vitals.domain.exception;

import lombok.Getter;

/**
 * Exception thrown when the upstream time series API rejects a request (4xx).
 * Retrying the same request cannot succeed.
 */
@Getter
public class TerminalApiException extends RuntimeException {
    
    private final int statusCode;
    
    public TerminalApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
    
    public TerminalApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
