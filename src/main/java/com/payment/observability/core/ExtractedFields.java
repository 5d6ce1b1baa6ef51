package com.payment.observability.core;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Provider fields pulled out by a {@link ProviderMapper}. Any of them may be null.
 */
@Value
@Builder
public class ExtractedFields {

    String providerTransactionId;
    String merchantId;
    /** Major units. Null together with {@code currency} when either is missing. */
    BigDecimal amount;
    String currency;
    String countryCode;
    Instant providerCreatedAt;
    Instant providerUpdatedAt;
}
