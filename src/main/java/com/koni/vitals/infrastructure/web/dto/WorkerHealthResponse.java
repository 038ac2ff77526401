package com.koni.vitals.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Response of the per-worker {@code health} endpoints: liveness plus the effective settings.
 */
@Getter
@AllArgsConstructor
public class WorkerHealthResponse {
    
    private final String status;
    private final String worker;
    private final Map<String, Object> config;
    
    public static WorkerHealthResponse healthy(String worker, Map<String, Object> config) {
        return new WorkerHealthResponse("healthy", worker, config);
    }
}
