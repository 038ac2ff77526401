package com.koni.vitals.infrastructure.resilience;

import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.TransientApiException;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry and Circuit Breaker configuration for the upstream API and cold storage uploads.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Failure threshold exceeded, requests fail fast
 * - HALF_OPEN: Testing if the API recovered, limited requests allowed
 */
@Slf4j
@Configuration
public class ResilienceConfiguration {
    
    public static final String TIMESERIES_API = "timeseries-api";
    public static final String COLD_UPLOAD = "cold-upload";
    
    /**
     * Circuit breaker settings for the time series API.
     *
     * Configuration:
     * - Sliding window: 10 calls (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 30 seconds
     * - Permitted calls in HALF_OPEN: 3
     * - 4xx responses are ignored; they say nothing about the API's health
     */
    @Bean
    public CircuitBreakerConfig timeseriesApiCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .ignoreExceptions(TerminalApiException.class)
            .build();
    }
    
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }
    
    @Bean
    public CircuitBreaker timeseriesApiCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(TIMESERIES_API);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Circuit breaker state transition: name={}, {} -> {}",
                        TIMESERIES_API,
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()));
        return circuitBreaker;
    }
    
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }
    
    /**
     * Retry for API calls: exponential backoff from the configured initial delay, transient
     * failures only.
     */
    @Bean
    public Retry timeseriesApiRetry(RetryRegistry registry, PipelineProperties properties) {
        PipelineProperties.Api api = properties.getApi();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(api.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(api.getInitialBackoff(), 2.0))
            .retryExceptions(TransientApiException.class)
            .build();
        return withRetryLogging(registry.retry(TIMESERIES_API, config));
    }
    
    /**
     * Retry for cold storage uploads, used by the archival engine before any hot row is deleted.
     */
    @Bean
    public Retry coldUploadRetry(RetryRegistry registry, PipelineProperties properties) {
        PipelineProperties.Archive archive = properties.getArchive();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(archive.getUploadAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(archive.getUploadBackoff(), 2.0))
            .retryExceptions(ColdStorageException.class)
            .build();
        return withRetryLogging(registry.retry(COLD_UPLOAD, config));
    }
    
    private Retry withRetryLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Retrying call: name={}, attempt={}, wait={}ms, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
        return retry;
    }
}
