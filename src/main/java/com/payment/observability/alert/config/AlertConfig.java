package com.payment.observability.alert.config;

import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.alert.llm.AlertEnrichmentService;
import com.payment.observability.alert.llm.NoOpAlertEnrichmentService;
import com.payment.observability.alert.messaging.AlertNotifier;
import com.payment.observability.alert.messaging.LoggingAlertNotifier;
import com.payment.observability.config.KafkaConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Clock;

/**
 * Alert producer on the payment-alerts topic plus the defaults that can be replaced by real
 * enrichment and notification beans.
 */
@Configuration
public class AlertConfig {

    @Bean
    public ProducerFactory<String, AlertEvent> alertProducerFactory(KafkaConfig kafkaConfig) {
        return new DefaultKafkaProducerFactory<>(kafkaConfig.producerProperties(), new StringSerializer(),
                KafkaConfig.jsonSerializer(AlertEvent.class));
    }

    @Bean
    public KafkaTemplate<String, AlertEvent> alertKafkaTemplate(ProducerFactory<String, AlertEvent> alertProducerFactory) {
        return new KafkaTemplate<>(alertProducerFactory);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock alertClock() {
        return Clock.systemUTC();
    }

    /** Replaced by LlmAlertEnrichmentService when payment.alerts.enrichment.enabled=true. */
    @Bean
    @ConditionalOnMissingBean(AlertEnrichmentService.class)
    public AlertEnrichmentService alertEnrichmentService() {
        return new NoOpAlertEnrichmentService();
    }

    /** Replaced by SlackWebhookNotifier when payment.alerts.slack.webhook-url is set. */
    @Bean
    @ConditionalOnMissingBean(AlertNotifier.class)
    public AlertNotifier alertNotifier() {
        return new LoggingAlertNotifier();
    }
}
