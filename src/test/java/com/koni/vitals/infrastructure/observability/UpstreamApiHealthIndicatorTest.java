package com.koni.vitals.infrastructure.observability;

import com.koni.vitals.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for UpstreamApiHealthIndicator.
 * Drives a real circuit breaker through its states.
 */
@UnitTest
class UpstreamApiHealthIndicatorTest {
    
    private CircuitBreaker circuitBreaker;
    private UpstreamApiHealthIndicator healthIndicator;
    
    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("timeseries-api");
        healthIndicator = new UpstreamApiHealthIndicator(circuitBreaker);
    }
    
    @Test
    void shouldReturnUpWhenCircuitIsClosed() {
        Health health = healthIndicator.health();
        
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("state", "CLOSED");
        assertThat(health.getDetails()).containsEntry("circuitBreaker", "timeseries-api");
    }
    
    @Test
    void shouldReturnDownWhenCircuitIsOpen() {
        // Given
        circuitBreaker.transitionToOpenState();
        
        // When
        Health health = healthIndicator.health();
        
        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("state", "OPEN");
    }
    
    @Test
    void shouldReturnUpWhileHalfOpen() {
        // Given
        circuitBreaker.transitionToOpenState();
        circuitBreaker.transitionToHalfOpenState();
        
        // When
        Health health = healthIndicator.health();
        
        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("state", "HALF_OPEN");
    }
    
    @Test
    void shouldReturnDownWhenForcedOpen() {
        circuitBreaker.transitionToForcedOpenState();
        
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
