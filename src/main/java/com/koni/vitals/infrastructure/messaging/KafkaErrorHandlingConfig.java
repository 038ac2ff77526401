package com.koni.vitals.infrastructure.messaging;

import com.koni.vitals.domain.exception.TerminalApiException;
import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import com.koni.vitals.infrastructure.observability.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.nio.charset.StandardCharsets;

/**
 * Kafka error handling for the sync window queue.
 *
 * - Exponential backoff retry strategy (2s, 4s, 8s, 16s, 32s)
 * - Requests that can never succeed (validation, unknown site, 4xx upstream) skip the retries
 * - Exhausted or non-retryable requests go to the dead letter topic
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaErrorHandlingConfig {
    
    private static final long INITIAL_INTERVAL = 2000L;
    private static final double MULTIPLIER = 2.0;
    private static final int MAX_ATTEMPTS = 5;
    
    private final PipelineMetrics metrics;
    private final PipelineProperties properties;
    
    @Bean
    public CommonErrorHandler syncWindowErrorHandler(KafkaTemplate<?, ?> kafkaTemplate) {
        String deadLetterTopic = properties.getKafka().getDeadLetterTopic();
        
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending sync window to DLQ: topic={}, key={}, value={}, error={}",
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            consumerRecord.value(),
                            exception.getMessage(),
                            exception);
                    metrics.recordDlqMessageSent();
                    return new TopicPartition(deadLetterTopic, -1);
                }
        );
        
        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);
        
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(
                ValidationException.class,
                UnknownSiteException.class,
                TerminalApiException.class);
        
        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) -> {
            log.warn("Retry attempt {} for sync window: topic={}, key={}, error={}",
                    deliveryAttempt,
                    consumerRecord.topic(),
                    consumerRecord.key(),
                    exception.getMessage());
            consumerRecord.headers().add("retry-count",
                    String.valueOf(deliveryAttempt).getBytes(StandardCharsets.UTF_8));
        });
        
        return errorHandler;
    }
}
