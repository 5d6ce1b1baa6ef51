package com.payment.observability.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.observability.domain.NormalizedPaymentEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for normalized payment events, serialized as JSON so any consumer can read them.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${payment.kafka.max-block-ms:5000}")
    private int maxBlockMs;

    /** Shared by every JSON producer; ISO-8601 dates instead of epoch numbers. */
    static ObjectMapper kafkaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** Base producer properties; ingestion must not stall when the broker is down. */
    public Map<String, Object> producerProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        return props;
    }

    /** JSON value serializer backed by the shared mapper. */
    public static <T> Serializer<T> jsonSerializer(Class<T> type) {
        ObjectMapper objectMapper = kafkaObjectMapper();
        return (topic, data) -> {
            if (data == null) {
                return null;
            }
            try {
                return objectMapper.writeValueAsBytes(data);
            } catch (Exception e) {
                log.error("Serialization of {} failed for topic={}", type.getSimpleName(), topic, e);
                throw new IllegalStateException("Failed to serialize " + type.getSimpleName(), e);
            }
        };
    }

    @Bean
    public ProducerFactory<String, NormalizedPaymentEvent> normalizedEventProducerFactory() {
        return new DefaultKafkaProducerFactory<>(producerProperties(), new StringSerializer(),
                jsonSerializer(NormalizedPaymentEvent.class));
    }

    @Bean
    public KafkaTemplate<String, NormalizedPaymentEvent> normalizedEventKafkaTemplate(
            ProducerFactory<String, NormalizedPaymentEvent> normalizedEventProducerFactory) {
        return new KafkaTemplate<>(normalizedEventProducerFactory);
    }
}
