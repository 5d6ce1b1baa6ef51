package com.payment.observability.alert.llm;

import com.payment.observability.alert.domain.AlertEvent;

import java.util.Optional;

/**
 * Default when enrichment is disabled. Registered by AlertConfig.
 */
public class NoOpAlertEnrichmentService implements AlertEnrichmentService {

    @Override
    public Optional<String> explain(AlertEvent alert) {
        return Optional.empty();
    }
}
