package com.payment.observability.core;

import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.PaymentStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Deterministic extractor for one provider's webhook shape.
 * Implementations are registered in a fixed order; the first one whose {@link #canHandle(Map)}
 * returns true normalizes the event.
 */
public interface ProviderMapper {

    /** Lower-cased canonical provider name stored on the normalized event. */
    String providerName();

    /** Fixed reliability estimate for events normalized by this mapper. */
    double confidence();

    boolean canHandle(Map<String, Object> raw);

    PaymentStatus mapStatus(Map<String, Object> raw);

    /** Empty for non-failed events or when the payload carries no failure code. */
    Optional<FailureReason> mapFailureReason(Map<String, Object> raw);

    ExtractedFields extractFields(Map<String, Object> raw);

    /** Raw provider status string as it appears in the payload. */
    default String providerStatus(Map<String, Object> raw) {
        return PayloadValues.string(raw, "status");
    }

    default String getMapperName() {
        return this.getClass().getSimpleName();
    }
}
