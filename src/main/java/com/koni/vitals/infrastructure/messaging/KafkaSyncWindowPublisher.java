package com.koni.vitals.infrastructure.messaging;

import com.koni.vitals.application.port.SyncWindowPublisher;
import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.domain.exception.QueueUnavailableException;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import io.micrometer.tracing.annotation.ContinueSpan;
import io.micrometer.tracing.annotation.SpanTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka implementation of the SyncWindowPublisher port.
 * Uses the site as partition key and waits for the broker acknowledgement.
 */
@Slf4j
@Service
public class KafkaSyncWindowPublisher implements SyncWindowPublisher {
    
    private final KafkaTemplate<String, SyncWindowRequested> kafkaTemplate;
    private final String topic;
    private final long sendTimeoutMillis;
    
    public KafkaSyncWindowPublisher(KafkaTemplate<String, SyncWindowRequested> kafkaTemplate,
                                    PipelineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getKafka().getWindowsTopic();
        this.sendTimeoutMillis = properties.getKafka().getSendTimeout().toMillis();
    }
    
    /**
     * @throws IllegalArgumentException if request is null
     * @throws QueueUnavailableException if the broker does not acknowledge within the send timeout
     */
    @Override
    @ContinueSpan(log = "sync-window-publish")
    public void publish(@SpanTag("site") SyncWindowRequested request) {
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        
        try {
            SendResult<String, SyncWindowRequested> result = kafkaTemplate
                    .send(topic, request.getSite(), request)
                    .get(sendTimeoutMillis, TimeUnit.MILLISECONDS);
            
            log.info("Published sync window: topic={}, partition={}, offset={}, site={}, requestId={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    request.getSite(),
                    request.getRequestId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueUnavailableException("Interrupted while publishing sync window", e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to publish sync window: site={}, requestId={}",
                    request.getSite(), request.getRequestId(), e);
            throw new QueueUnavailableException("Failed to publish sync window for site " + request.getSite(), e);
        } catch (RuntimeException e) {
            log.error("Failed to publish sync window: site={}, requestId={}",
                    request.getSite(), request.getRequestId(), e);
            throw new QueueUnavailableException("Failed to publish sync window for site " + request.getSite(), e);
        }
    }
}
