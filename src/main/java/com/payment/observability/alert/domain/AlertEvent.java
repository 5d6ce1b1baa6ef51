package com.payment.observability.alert.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Anomaly found by the alert detection engine. Recomputed on every detection run, never persisted here.
 * Only the metrics relevant to the alert type are set.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertEvent {

    String alertId;
    AlertSeverity severity;
    AlertType type;
    String title;
    String message;

    String provider;
    Double successRate;
    Long totalEvents;
    Long failedEvents;
    List<DimensionStats> merchantsAffected;
    List<DimensionStats> countriesAffected;
    List<FailureReasonCount> topFailures;

    Double previousSuccessRate;
    Double dropPercentage;
    List<CountryConversionDrop> countryAnalysis;

    String errorReason;
    Long errorCount;
    Map<String, Long> errorSources;

    Instant detectedAt;
    Instant windowStart;
    Instant windowEnd;
    Instant previousWindowStart;

    /** Narrative added by alert enrichment, when enabled. */
    String detailedExplanation;
}
