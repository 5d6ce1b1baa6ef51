package com.payment.observability.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Canonical payment event produced by a normalizer. Created once, persisted once and never mutated.
 * Amount and currency travel together: when {@code amount} is set, {@code currency} is set too.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizedPaymentEvent {

    UUID id;
    String merchantName;
    /** Lower-cased canonical provider name, e.g. "stripe". */
    String provider;
    /** ISO-3166 alpha-2, "XX" when unknown. */
    String country;
    String transactionalId;
    PaymentStatus statusCategory;
    FailureReason failureReason;
    ErrorSource errorSource;
    Integer httpStatusCode;
    BigDecimal amount;
    String currency;
    BigDecimal amountUsd;
    String providerTransactionId;
    String providerStatus;
    Integer latencyMs;
    NormalizationMethod normalizationMethod;
    double confidenceScore;
    Map<String, Object> rawData;
    Map<String, Object> metadata;
    Instant createdAt;
    Instant normalizedAt;
    Instant updatedAt;
}
