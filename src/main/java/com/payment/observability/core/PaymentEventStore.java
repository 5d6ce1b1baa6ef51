package com.payment.observability.core;

import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read/write contract for normalized events. Implementations raise
 * {@link com.payment.observability.core.exception.RepositoryException} on storage failures.
 */
public interface PaymentEventStore {

    NormalizedPaymentEvent save(NormalizedPaymentEvent event);

    Optional<NormalizedPaymentEvent> findById(UUID id);

    Optional<NormalizedPaymentEvent> findByProviderTransactionId(String providerTransactionId);

    /** Events still in {@link PaymentStatus#UNPROCESSED}, oldest first. */
    List<NormalizedPaymentEvent> findUnprocessed(int limit);

    /** Null filters are ignored. Newest first. */
    List<NormalizedPaymentEvent> findByFilters(String provider, PaymentStatus status, String merchantName,
                                               String country, int limit, int offset);

    long countByStatus(PaymentStatus status);
}
