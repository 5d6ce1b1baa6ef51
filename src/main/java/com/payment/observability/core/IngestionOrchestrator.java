package com.payment.observability.core;

import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.messaging.NormalizedEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for ingestion: picks rule-based normalization when a mapper recognizes the payload,
 * AI normalization otherwise, and persists the single resulting event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private final RuleBasedNormalizer ruleBasedNormalizer;
    private final AiBasedNormalizer aiBasedNormalizer;
    private final PaymentEventStore eventStore;
    private final NormalizedEventProducer eventProducer;

    /**
     * Normalizes and persists one raw event. Nothing is stored when normalization fails, and every
     * failure propagates to the caller unchanged.
     *
     * @param raw          provider payload
     * @param providerHint optional provider name from the source; currently informational only and
     *                     does not influence mapper selection
     * @throws IllegalArgumentException when {@code raw} is null or empty
     */
    public NormalizedPaymentEvent ingest(Map<String, Object> raw, String providerHint) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Raw payment event must not be empty");
        }
        long startMs = System.currentTimeMillis();

        Optional<ProviderMapper> mapper = ruleBasedNormalizer.findMapper(raw);
        PaymentNormalizer normalizer = mapper.isPresent() ? ruleBasedNormalizer : aiBasedNormalizer;
        log.info("Ingesting event providerHint={} normalizer={} mapper={}",
                providerHint, normalizer.getMethod(), mapper.map(ProviderMapper::getMapperName).orElse(null));

        NormalizedPaymentEvent normalized = normalizer.normalize(raw);
        NormalizedPaymentEvent saved = eventStore.save(normalized);
        eventProducer.publish(saved);

        log.info("Ingested event id={} provider={} status={} method={} confidence={} tookMs={}",
                saved.getId(), saved.getProvider(), saved.getStatusCategory(), saved.getNormalizationMethod(),
                saved.getConfidenceScore(), System.currentTimeMillis() - startMs);
        return saved;
    }
}
