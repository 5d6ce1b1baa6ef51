package com.payment.observability.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.observability.ai.AiNormalizationOutput;
import com.payment.observability.ai.ExtractionResult;
import com.payment.observability.ai.NormalizationPrompts;
import com.payment.observability.ai.StructuredExtractionClient;
import com.payment.observability.core.exception.NormalizationException;
import com.payment.observability.domain.CurrencyConverter;
import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Universal fallback: asks a language model to map an unknown provider payload onto the canonical schema.
 * Fields the model leaves null stay null.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiBasedNormalizer implements PaymentNormalizer {

    static final double CONFIDENCE = 0.95;

    private final StructuredExtractionClient extractionClient;
    private final ObjectMapper objectMapper;

    @Override
    public NormalizationMethod getMethod() {
        return NormalizationMethod.AI_BASED;
    }

    @Override
    public boolean canNormalize(Map<String, Object> raw) {
        return true;
    }

    @Override
    public NormalizedPaymentEvent normalize(Map<String, Object> raw) {
        long startNanos = System.nanoTime();
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new NormalizationException("Raw payment event cannot be serialized for AI normalization", e);
        }

        ExtractionResult<AiNormalizationOutput> result = extractionClient.extract(
                NormalizationPrompts.SYSTEM_PROMPT,
                NormalizationPrompts.userMessage(payloadJson),
                AiNormalizationOutput.class);
        AiNormalizationOutput output = result.getOutput();

        String currency = PayloadValues.upper(output.getCurrency());
        BigDecimal amount = currency != null ? PayloadValues.toMoney(output.getAmount()) : null;

        String merchantName = output.getMerchantName() != null
                ? output.getMerchantName()
                : valueOrDefault(PayloadValues.string(raw, EnrichmentFields.MERCHANT_NAME), EnrichmentFields.UNKNOWN_MERCHANT);
        String country = output.getCountry() != null
                ? output.getCountry().toUpperCase()
                : valueOrDefault(PayloadValues.countryCode(PayloadValues.string(raw, EnrichmentFields.MERCHANT_COUNTRY)),
                        EnrichmentFields.UNKNOWN_COUNTRY);

        long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model_used", result.getModelUsed());
        metadata.put("fallback_used", result.isFallbackUsed());
        metadata.put("prompt_version", NormalizationPrompts.PROMPT_VERSION);
        metadata.put("normalization_latency_ms", latencyMs);

        Instant now = Instant.now();
        NormalizedPaymentEvent event = NormalizedPaymentEvent.builder()
                .id(UUID.randomUUID())
                .merchantName(merchantName)
                .provider(output.getProvider().trim().toLowerCase())
                .country(country)
                .transactionalId(PayloadValues.string(raw, EnrichmentFields.TRANSACTIONAL_ID))
                .statusCategory(output.getStatusCategory())
                .failureReason(output.getFailureReason())
                .errorSource(output.getErrorSource())
                .httpStatusCode(output.getHttpStatusCode())
                .amount(amount)
                .currency(currency)
                .amountUsd(CurrencyConverter.toUsd(amount, currency))
                .providerTransactionId(output.getProviderTransactionId())
                .providerStatus(output.getProviderStatus())
                .latencyMs(output.getLatencyMs())
                .normalizationMethod(NormalizationMethod.AI_BASED)
                .confidenceScore(CONFIDENCE)
                .rawData(new LinkedHashMap<>(raw))
                .metadata(metadata)
                .createdAt(now)
                .normalizedAt(now)
                .updatedAt(now)
                .build();
        log.info("AI normalization provider={} status={} model={} fallbackUsed={} latencyMs={}",
                event.getProvider(), event.getStatusCategory(), result.getModelUsed(), result.isFallbackUsed(), latencyMs);
        return event;
    }

    private static String valueOrDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
