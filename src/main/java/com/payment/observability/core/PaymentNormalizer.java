package com.payment.observability.core;

import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;

import java.util.Map;

/**
 * Turns a raw provider payload into a {@link NormalizedPaymentEvent}.
 */
public interface PaymentNormalizer {

    NormalizationMethod getMethod();

    boolean canNormalize(Map<String, Object> raw);

    /**
     * @throws com.payment.observability.core.exception.NormalizationException when the event cannot be normalized
     */
    NormalizedPaymentEvent normalize(Map<String, Object> raw);
}
