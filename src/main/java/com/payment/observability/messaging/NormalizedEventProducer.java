package com.payment.observability.messaging;

import com.payment.observability.domain.NormalizedPaymentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes persisted normalized events for downstream analytics. Keyed by provider so each provider's
 * events stay ordered. Publication problems are logged and never fail ingestion.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NormalizedEventProducer {

    private final KafkaTemplate<String, NormalizedPaymentEvent> normalizedEventKafkaTemplate;

    @Value("${payment.kafka.topic.normalized-events:normalized-payment-events}")
    private String topic;

    @Value("${payment.kafka.publish-enabled:true}")
    private boolean publishEnabled;

    public void publish(NormalizedPaymentEvent event) {
        if (!publishEnabled) {
            return;
        }
        String key = event.getProvider();
        try {
            CompletableFuture<SendResult<String, NormalizedPaymentEvent>> future =
                    normalizedEventKafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish normalized event id={} provider={}", event.getId(), key, ex);
                } else {
                    log.debug("Published normalized event id={} partition={} offset={}",
                            event.getId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (RuntimeException e) {
            log.error("Kafka unavailable, normalized event id={} not published: {}", event.getId(), e.getMessage());
        }
    }
}
