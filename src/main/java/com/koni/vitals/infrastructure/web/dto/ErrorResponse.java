package com.koni.vitals.infrastructure.web.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * DTO for error responses returned by the control API.
 */
public class ErrorResponse {
    
    private final int status;
    private final String message;
    private final List<String> details;
    private final Instant timestamp;
    
    public ErrorResponse(int status, String message) {
        this(status, message, Collections.emptyList());
    }
    
    public ErrorResponse(int status, String message, List<String> details) {
        this.status = status;
        this.message = message;
        this.details = details == null ? Collections.emptyList() : List.copyOf(details);
        this.timestamp = Instant.now();
    }
    
    public int getStatus() {
        return status;
    }
    
    public String getMessage() {
        return message;
    }
    
    public List<String> getDetails() {
        return details;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
}
