package com.payment.observability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the payment observability engine. Enables:
 * <ul>
 *   <li>Normalization of Stripe, Adyen and Mercado Pago events by rule, and of any other provider by LLM</li>
 *   <li>Background ingestion from the raw data lake (PostgreSQL) with Redis deduplication</li>
 *   <li>Alert detection over normalized events, published to Kafka</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class PaymentObservabilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentObservabilityApplication.class, args);
    }
}
