package com.payment.observability.core;

import com.payment.observability.domain.RawIngestionRecord;

import java.util.List;

/**
 * External store of raw provider events awaiting normalization.
 */
public interface RawEventSource {

    /** Up to {@code limit} unacknowledged records, oldest first. */
    List<RawIngestionRecord> getUnprocessedBatch(int limit);

    /** Marks the records processed; returns how many rows changed (0 for an empty list). */
    int markProcessed(List<String> ids);

    /** Total records, or only processed/unprocessed ones when {@code processed} is not null. */
    long countRecords(Boolean processed);

    boolean isHealthy();
}
