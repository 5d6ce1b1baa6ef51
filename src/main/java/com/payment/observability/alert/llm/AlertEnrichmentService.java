package com.payment.observability.alert.llm;

import com.payment.observability.alert.domain.AlertEvent;

import java.util.Optional;

/**
 * Generates a human-readable explanation for a detected alert. Detection itself works on aggregates
 * only; the explanation is presentation and may be skipped.
 */
public interface AlertEnrichmentService {

    /**
     * Short narrative for the alert, or empty to leave the alert as detected.
     */
    Optional<String> explain(AlertEvent alert);
}
