package com.koni.vitals.infrastructure.observability;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the upstream time series API, derived from its circuit breaker.
 *
 * OPEN reports DOWN; HALF_OPEN reports UP with the state in the details so probes do not
 * flap while the breaker is testing recovery.
 */
@Slf4j
@Component
public class UpstreamApiHealthIndicator implements HealthIndicator {
    
    private final CircuitBreaker circuitBreaker;
    
    public UpstreamApiHealthIndicator(@Qualifier("timeseriesApiCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }
    
    @Override
    public Health health() {
        CircuitBreaker.State state = circuitBreaker.getState();
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
        
        if (state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN) {
            log.warn("Upstream API health check failed: circuitBreaker={}, state={}", circuitBreaker.getName(), state);
            return Health.down()
                    .withDetail("circuitBreaker", circuitBreaker.getName())
                    .withDetail("state", state.name())
                    .withDetail("failureRate", metrics.getFailureRate())
                    .withDetail("message", "Upstream API calls are short-circuited")
                    .build();
        }
        return Health.up()
                .withDetail("circuitBreaker", circuitBreaker.getName())
                .withDetail("state", state.name())
                .withDetail("bufferedCalls", metrics.getNumberOfBufferedCalls())
                .build();
    }
}
