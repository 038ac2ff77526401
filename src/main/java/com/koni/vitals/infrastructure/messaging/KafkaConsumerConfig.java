package com.koni.vitals.infrastructure.messaging;

import com.koni.vitals.domain.event.SyncWindowRequested;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.JsonDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumer configuration for SyncWindowRequested events.
 *
 * Configuration features:
 * - JSON deserialization for event payloads
 * - Manual acknowledgment mode for offset control
 * - Listener auto-startup controlled by {@code vitals.kafka.listener-auto-startup}
 */
@Configuration
@EnableKafka
public class KafkaConsumerConfig {
    
    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;
    
    @Value("${spring.kafka.consumer.group-id}")
    private String groupId;
    
    @Value("${spring.kafka.consumer.auto-offset-reset:earliest}")
    private String autoOffsetReset;
    
    @Bean
    public ConsumerFactory<String, SyncWindowRequested> consumerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        
        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);
        
        configProps.put(JsonDeserializer.TRUSTED_PACKAGES, "com.koni.vitals.domain.event");
        configProps.put(JsonDeserializer.VALUE_DEFAULT_TYPE, SyncWindowRequested.class.getName());
        configProps.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        
        return new DefaultKafkaConsumerFactory<>(
                configProps,
                new StringDeserializer(),
                new JsonDeserializer<>(SyncWindowRequested.class, false)
        );
    }
    
    /**
     * Listener container factory with manual acknowledgment and the dead-letter error handler.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, SyncWindowRequested> kafkaListenerContainerFactory(
            CommonErrorHandler syncWindowErrorHandler,
            PipelineProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, SyncWindowRequested> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        
        factory.setConsumerFactory(consumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setCommonErrorHandler(syncWindowErrorHandler);
        factory.setAutoStartup(properties.getKafka().isListenerAutoStartup());
        
        return factory;
    }
}
