package com.payment.observability.alert.messaging;

import com.payment.observability.alert.domain.AlertEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes detected alerts for dashboards and downstream automation. Keyed by provider where the alert
 * has one, otherwise by alert type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEventProducer {

    private final KafkaTemplate<String, AlertEvent> alertKafkaTemplate;

    @Value("${payment.kafka.topic.alerts:payment-alerts}")
    private String topic;

    @Value("${payment.kafka.publish-enabled:true}")
    private boolean publishEnabled;

    public void send(AlertEvent alert) {
        if (!publishEnabled) {
            return;
        }
        String key = alert.getProvider() != null ? alert.getProvider() : alert.getType().name();
        try {
            CompletableFuture<SendResult<String, AlertEvent>> future = alertKafkaTemplate.send(topic, key, alert);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to send alert {}", alert.getAlertId(), ex);
                else log.debug("Sent alert {} partition={}", alert.getAlertId(), result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (RuntimeException e) {
            log.error("Kafka unavailable, alert {} not published: {}", alert.getAlertId(), e.getMessage());
        }
    }
}
