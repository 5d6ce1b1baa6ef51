package com.payment.observability.ingestion;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one ingestion cycle.
 */
@Value
@Builder
public class BatchProcessingReport {

    int fetched;
    int ingested;
    /** Already ingested in an earlier cycle whose acknowledgment failed; acknowledged without re-ingesting. */
    int duplicates;
    int failed;
    int acknowledged;
    /** True when another cycle was in flight and this one did nothing. */
    boolean skipped;
    Instant startedAt;
    long durationMs;

    static BatchProcessingReport skipped(Instant now) {
        return BatchProcessingReport.builder().skipped(true).startedAt(now).build();
    }
}
