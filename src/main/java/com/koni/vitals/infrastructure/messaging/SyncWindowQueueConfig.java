package com.koni.vitals.infrastructure.messaging;

import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishing side of the sync window queue: the request and dead-letter topics, and the producer
 * behind {@link KafkaSyncWindowPublisher}.
 *
 * Requests are keyed by site, so windows of one site stay ordered within a partition. The producer
 * blocks on metadata for at most {@code vitals.kafka.send-timeout}, the same bound the publisher
 * waits for an acknowledgement, so a missing broker answers 503 instead of hanging the request.
 */
@Configuration
public class SyncWindowQueueConfig {
    
    static final String CLIENT_ID = "vitals-sync-window-publisher";
    
    private final PipelineProperties.Kafka kafka;
    
    public SyncWindowQueueConfig(PipelineProperties properties) {
        this.kafka = properties.getKafka();
    }
    
    @Bean
    public NewTopic syncWindowsTopic() {
        return topic(kafka.getWindowsTopic());
    }
    
    @Bean
    public NewTopic syncWindowsDeadLetterTopic() {
        return topic(kafka.getDeadLetterTopic());
    }
    
    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicationFactor())
                .build();
    }
    
    @Bean
    public ProducerFactory<String, SyncWindowRequested> syncWindowProducerFactory(KafkaProperties kafkaProperties) {
        return new DefaultKafkaProducerFactory<>(producerProperties(kafkaProperties));
    }
    
    @Bean
    public KafkaTemplate<String, SyncWindowRequested> syncWindowKafkaTemplate(
            ProducerFactory<String, SyncWindowRequested> syncWindowProducerFactory) {
        KafkaTemplate<String, SyncWindowRequested> template = new KafkaTemplate<>(syncWindowProducerFactory);
        template.setDefaultTopic(kafka.getWindowsTopic());
        template.setObservationEnabled(true);
        return template;
    }
    
    Map<String, Object> producerProperties(KafkaProperties kafkaProperties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", kafkaProperties.getBootstrapServers()));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, kafka.getSendTimeout().toMillis());
        return props;
    }
}
