package com.payment.observability.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Unprocessed row from the raw ingestion table. Read-only; acknowledged once its event is persisted.
 */
@Value
@Builder
public class RawIngestionRecord {

    String id;
    /** Provider payload exactly as received (the {@code data} object of the stored JSON). */
    Map<String, Object> data;
    MerchantDescriptor merchant;
    String transactionalId;
    Instant createdAt;
}
