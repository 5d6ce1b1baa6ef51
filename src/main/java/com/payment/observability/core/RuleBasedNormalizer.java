package com.payment.observability.core;

import com.payment.observability.core.exception.NormalizationException;
import com.payment.observability.domain.CurrencyConverter;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Deterministic normalization through the registered {@link ProviderMapper}s.
 * Mappers are scanned in registration order and the first that recognizes the payload wins.
 */
@Slf4j
@Service
public class RuleBasedNormalizer implements PaymentNormalizer {

    private final List<ProviderMapper> mappers;

    public RuleBasedNormalizer(List<ProviderMapper> mappers) {
        this.mappers = List.copyOf(mappers);
        log.info("Rule-based normalizer registered mappers={}",
                this.mappers.stream().map(ProviderMapper::getMapperName).toList());
    }

    @Override
    public NormalizationMethod getMethod() {
        return NormalizationMethod.RULE_BASED;
    }

    /**
     * First mapper that claims the payload. A mapper whose {@code canHandle} throws is treated as
     * not handling it.
     */
    public Optional<ProviderMapper> findMapper(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) return Optional.empty();
        for (ProviderMapper mapper : mappers) {
            try {
                if (mapper.canHandle(raw)) {
                    return Optional.of(mapper);
                }
            } catch (RuntimeException e) {
                log.warn("Mapper {} failed to inspect payload, skipping: {}", mapper.getMapperName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean canNormalize(Map<String, Object> raw) {
        return findMapper(raw).isPresent();
    }

    /**
     * Normalizes with the first matching mapper, or returns empty when none recognizes the payload.
     *
     * @throws NormalizationException if the matched mapper fails while extracting fields
     */
    public Optional<NormalizedPaymentEvent> tryNormalize(Map<String, Object> raw) {
        return findMapper(raw).map(mapper -> normalizeWith(mapper, raw));
    }

    @Override
    public NormalizedPaymentEvent normalize(Map<String, Object> raw) {
        return tryNormalize(raw).orElseThrow(() ->
                new NormalizationException("No rule-based mapper recognizes this payment event"));
    }

    private NormalizedPaymentEvent normalizeWith(ProviderMapper mapper, Map<String, Object> raw) {
        long startNanos = System.nanoTime();
        try {
            PaymentStatus status = mapper.mapStatus(raw);
            FailureReason failureReason = mapper.mapFailureReason(raw).orElse(null);
            ExtractedFields fields = mapper.extractFields(raw);

            String merchantName = firstNonNull(fields.getMerchantId(),
                    PayloadValues.string(raw, EnrichmentFields.MERCHANT_NAME), EnrichmentFields.UNKNOWN_MERCHANT);
            String country = firstNonNull(PayloadValues.countryCode(fields.getCountryCode()),
                    PayloadValues.countryCode(PayloadValues.string(raw, EnrichmentFields.MERCHANT_COUNTRY)),
                    EnrichmentFields.UNKNOWN_COUNTRY);

            long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("mapper_used", mapper.getMapperName());
            metadata.put("normalization_latency_ms", latencyMs);
            if (fields.getProviderCreatedAt() != null) {
                metadata.put("provider_created_at", fields.getProviderCreatedAt().toString());
            }
            if (fields.getProviderUpdatedAt() != null) {
                metadata.put("provider_updated_at", fields.getProviderUpdatedAt().toString());
            }

            Instant now = Instant.now();
            NormalizedPaymentEvent event = NormalizedPaymentEvent.builder()
                    .id(UUID.randomUUID())
                    .merchantName(merchantName)
                    .provider(mapper.providerName())
                    .country(country)
                    .transactionalId(PayloadValues.string(raw, EnrichmentFields.TRANSACTIONAL_ID))
                    .statusCategory(status)
                    .failureReason(failureReason)
                    .errorSource(failureReason != null ? failureReason.getDefaultErrorSource() : null)
                    .amount(fields.getAmount())
                    .currency(fields.getCurrency())
                    .amountUsd(CurrencyConverter.toUsd(fields.getAmount(), fields.getCurrency()))
                    .providerTransactionId(fields.getProviderTransactionId())
                    .providerStatus(mapper.providerStatus(raw))
                    .normalizationMethod(NormalizationMethod.RULE_BASED)
                    .confidenceScore(mapper.confidence())
                    .rawData(new LinkedHashMap<>(raw))
                    .metadata(metadata)
                    .createdAt(now)
                    .normalizedAt(now)
                    .updatedAt(now)
                    .build();
            log.debug("Rule-based normalization mapper={} status={} providerTxId={}",
                    mapper.getMapperName(), status, fields.getProviderTransactionId());
            return event;
        } catch (NormalizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NormalizationException(
                    "Rule-based normalization failed in " + mapper.getMapperName() + ": " + e.getMessage(), e);
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) return value;
        }
        return null;
    }
}
