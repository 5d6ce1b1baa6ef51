package com.payment.observability.alert.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.observability.ai.ExtractionResult;
import com.payment.observability.ai.StructuredExtractionClient;
import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.core.exception.NormalizationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Asks the configured chat model for an operator-facing explanation of an alert.
 * Active only with {@code payment.alerts.enrichment.enabled=true}; any failure leaves the alert plain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.alerts.enrichment.enabled", havingValue = "true")
public class LlmAlertEnrichmentService implements AlertEnrichmentService {

    static final String SYSTEM_PROMPT = """
            You are a payments operations analyst. You receive one alert produced from aggregated payment
            events (success rates, failure reasons, affected merchants and countries). Explain it to an
            on-call engineer in two or three sentences, give the most likely root cause, and list up to
            three concrete actions. Do not invent numbers that are not in the alert.
            Respond with a single JSON object with keys:
            "explanation" (string), "root_cause_hypothesis" (string), "recommended_actions" (array of strings),
            "urgency" (one of "immediate", "high", "medium", "low").
            """;

    private final StructuredExtractionClient extractionClient;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<String> explain(AlertEvent alert) {
        try {
            String alertJson = objectMapper.writeValueAsString(alert.toBuilder().detailedExplanation(null).build());
            ExtractionResult<AlertInsight> result = extractionClient.extract(
                    SYSTEM_PROMPT, "Explain this payment alert:\n\n" + alertJson, AlertInsight.class);
            log.debug("Alert {} enriched by model={} fallbackUsed={}",
                    alert.getAlertId(), result.getModelUsed(), result.isFallbackUsed());
            return Optional.of(result.getOutput().render());
        } catch (JsonProcessingException | NormalizationException e) {
            log.warn("Alert enrichment failed for alert={} type={}: {}", alert.getAlertId(), alert.getType(), e.getMessage());
            return Optional.empty();
        }
    }
}
