package com.koni.vitals.infrastructure.resilience;

import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.TransientApiException;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.support.TestProperties;
import com.koni.vitals.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ResilienceConfiguration.
 * Verifies breaker settings and which failures each retry repeats.
 */
@UnitTest
class ResilienceConfigurationTest {
    
    private final ResilienceConfiguration configuration = new ResilienceConfiguration();
    private final PipelineProperties properties = TestProperties.defaults();
    private RetryRegistry retryRegistry;
    
    @BeforeEach
    void setUp() {
        retryRegistry = configuration.retryRegistry();
    }
    
    @Test
    void shouldConfigureCircuitBreakerWithCorrectSettings() {
        CircuitBreakerConfig config = configuration.timeseriesApiCircuitBreakerConfig();
        
        assertThat(config.getSlidingWindowType()).isEqualTo(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED);
        assertThat(config.getSlidingWindowSize()).isEqualTo(10);
        assertThat(config.getFailureRateThreshold()).isEqualTo(50.0f);
        assertThat(config.getWaitIntervalFunctionInOpenState().apply(1)).isEqualTo(Duration.ofSeconds(30).toMillis());
        assertThat(config.getPermittedNumberOfCallsInHalfOpenState()).isEqualTo(3);
        assertThat(config.isAutomaticTransitionFromOpenToHalfOpenEnabled()).isTrue();
    }
    
    @Test
    void shouldNotCountClientErrorsAgainstTheBreaker() {
        // Given
        CircuitBreakerConfig config = configuration.timeseriesApiCircuitBreakerConfig();
        CircuitBreaker breaker = configuration.timeseriesApiCircuitBreaker(configuration.circuitBreakerRegistry(config));
        
        // When
        for (int i = 0; i < 20; i++) {
            try {
                breaker.executeRunnable(() -> {
                    throw new TerminalApiException(400, "bad request");
                });
            } catch (TerminalApiException expected) {
                // each call is rejected by the API, not the breaker
            }
        }
        
        // Then
        assertThat(breaker.getName()).isEqualTo(ResilienceConfiguration.TIMESERIES_API);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }
    
    @Test
    void shouldRetryTransientApiFailuresUpToMaxAttempts() {
        // Given
        Retry retry = configuration.timeseriesApiRetry(retryRegistry, properties);
        AtomicInteger attempts = new AtomicInteger();
        
        // When / Then
        assertThatThrownBy(() -> retry.executeRunnable(() -> {
            attempts.incrementAndGet();
            throw new TransientApiException("upstream 503");
        })).isInstanceOf(TransientApiException.class);
        assertThat(attempts.get()).isEqualTo(3);
    }
    
    @Test
    void shouldNotRetryTerminalApiFailures() {
        // Given
        Retry retry = configuration.timeseriesApiRetry(retryRegistry, properties);
        AtomicInteger attempts = new AtomicInteger();
        
        // When / Then
        assertThatThrownBy(() -> retry.executeRunnable(() -> {
            attempts.incrementAndGet();
            throw new TerminalApiException(404, "unknown site");
        })).isInstanceOf(TerminalApiException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }
    
    @Test
    void shouldRetryColdStorageFailures() {
        // Given
        Retry retry = configuration.coldUploadRetry(retryRegistry, properties);
        AtomicInteger attempts = new AtomicInteger();
        
        // When
        String result = retry.executeSupplier(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ColdStorageException("disk busy");
            }
            return "stored";
        });
        
        // Then
        assertThat(result).isEqualTo("stored");
        assertThat(retry.getName()).isEqualTo(ResilienceConfiguration.COLD_UPLOAD);
    }
}
