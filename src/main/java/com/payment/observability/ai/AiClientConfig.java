package com.payment.observability.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Model clients for AI normalization and alert enrichment. The secondary model is optional.
 */
@Slf4j
@Configuration
public class AiClientConfig {

    @Value("${payment.ai.primary.base-url:https://api.openai.com/v1}")
    private String primaryBaseUrl;

    @Value("${payment.ai.primary.api-key:}")
    private String primaryApiKey;

    @Value("${payment.ai.primary.model:gpt-4o-mini}")
    private String primaryModel;

    @Value("${payment.ai.secondary.enabled:false}")
    private boolean secondaryEnabled;

    @Value("${payment.ai.secondary.base-url:https://generativelanguage.googleapis.com/v1beta/openai}")
    private String secondaryBaseUrl;

    @Value("${payment.ai.secondary.api-key:}")
    private String secondaryApiKey;

    @Value("${payment.ai.secondary.model:gemini-2.0-flash-lite}")
    private String secondaryModel;

    @Value("${payment.ai.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${payment.ai.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${payment.ai.retry.initial-backoff-ms:2000}")
    private long initialBackoffMs;

    @Value("${payment.ai.retry.multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${payment.ai.retry.max-backoff-ms:10000}")
    private long maxBackoffMs;

    @Bean
    public StructuredExtractionClient structuredExtractionClient(RetryRegistry retryRegistry,
                                                                 CircuitBreakerRegistry circuitBreakerRegistry,
                                                                 ObjectMapper objectMapper,
                                                                 Validator validator) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        if (primaryApiKey == null || primaryApiKey.isBlank()) {
            log.warn("payment.ai.primary.api-key is not set; AI normalization calls will be rejected by the model endpoint");
        }
        ChatModelClient primary = new ChatModelClient(primaryBaseUrl, primaryApiKey, primaryModel, timeout);
        ChatModelClient secondary = secondaryEnabled
                ? new ChatModelClient(secondaryBaseUrl, secondaryApiKey, secondaryModel, timeout)
                : null;
        AiRetrySettings settings = AiRetrySettings.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .backoffMultiplier(backoffMultiplier)
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .timeoutSeconds(timeoutSeconds)
                .build();
        return new StructuredExtractionClient(primary, secondary, retryRegistry, circuitBreakerRegistry,
                objectMapper, validator, settings);
    }
}
