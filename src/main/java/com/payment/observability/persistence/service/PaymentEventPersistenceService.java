package com.payment.observability.persistence.service;

import com.payment.observability.core.PaymentEventStore;
import com.payment.observability.core.exception.RepositoryException;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import com.payment.observability.persistence.entity.NormalizedPaymentEventEntity;
import com.payment.observability.persistence.repository.NormalizedPaymentEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed {@link PaymentEventStore}. Storage errors are never swallowed: they surface as
 * {@link RepositoryException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentEventPersistenceService implements PaymentEventStore {

    private final NormalizedPaymentEventRepository repository;

    @Override
    @Transactional
    public NormalizedPaymentEvent save(NormalizedPaymentEvent event) {
        try {
            NormalizedPaymentEventEntity saved = repository.save(toEntity(event));
            log.debug("Persisted normalized event id={} provider={} status={}",
                    saved.getId(), saved.getProvider(), saved.getStatusCategory());
            return toDomain(saved);
        } catch (DataAccessException e) {
            log.error("Failed to persist normalized event id={} provider={}: {}",
                    event.getId(), event.getProvider(), e.getMessage());
            throw new RepositoryException("Failed to persist normalized event " + event.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<NormalizedPaymentEvent> findById(UUID id) {
        try {
            return repository.findById(id).map(this::toDomain);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to load normalized event " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<NormalizedPaymentEvent> findByProviderTransactionId(String providerTransactionId) {
        try {
            return repository.findFirstByProviderTransactionIdOrderByCreatedAtDesc(providerTransactionId)
                    .map(this::toDomain);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to load event for providerTransactionId " + providerTransactionId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<NormalizedPaymentEvent> findUnprocessed(int limit) {
        try {
            return repository.findByStatusCategoryOrderByCreatedAtAsc(PaymentStatus.UNPROCESSED, PageRequest.of(0, limit))
                    .stream()
                    .map(this::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to load unprocessed events", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<NormalizedPaymentEvent> findByFilters(String provider, PaymentStatus status, String merchantName,
                                                      String country, int limit, int offset) {
        Specification<NormalizedPaymentEventEntity> spec = Specification.where(null);
        if (provider != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("provider"), provider.toLowerCase()));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("statusCategory"), status));
        }
        if (merchantName != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("merchantName"), merchantName));
        }
        if (country != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("country"), country.toUpperCase()));
        }
        try {
            // offsets need not align with page boundaries, so fetch offset + limit and skip
            return repository.findAll(spec, PageRequest.of(0, offset + limit, Sort.by(Sort.Direction.DESC, "createdAt")))
                    .stream()
                    .skip(offset)
                    .map(this::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to query normalized events", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(PaymentStatus status) {
        try {
            return repository.countByStatusCategory(status);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to count events with status " + status, e);
        }
    }

    private NormalizedPaymentEventEntity toEntity(NormalizedPaymentEvent event) {
        return NormalizedPaymentEventEntity.builder()
                .id(event.getId())
                .merchantName(event.getMerchantName())
                .provider(event.getProvider())
                .country(event.getCountry())
                .transactionalId(event.getTransactionalId())
                .statusCategory(event.getStatusCategory())
                .failureReason(event.getFailureReason())
                .errorSource(event.getErrorSource())
                .httpStatusCode(event.getHttpStatusCode())
                .amount(event.getAmount())
                .currency(event.getCurrency())
                .amountUsd(event.getAmountUsd())
                .providerTransactionId(event.getProviderTransactionId())
                .providerStatus(event.getProviderStatus())
                .latencyMs(event.getLatencyMs())
                .normalizationMethod(event.getNormalizationMethod())
                .confidenceScore(event.getConfidenceScore())
                .rawData(event.getRawData())
                .metadata(event.getMetadata())
                .createdAt(event.getCreatedAt())
                .normalizedAt(event.getNormalizedAt())
                .updatedAt(event.getUpdatedAt())
                .build();
    }

    private NormalizedPaymentEvent toDomain(NormalizedPaymentEventEntity entity) {
        return NormalizedPaymentEvent.builder()
                .id(entity.getId())
                .merchantName(entity.getMerchantName())
                .provider(entity.getProvider())
                .country(entity.getCountry())
                .transactionalId(entity.getTransactionalId())
                .statusCategory(entity.getStatusCategory())
                .failureReason(entity.getFailureReason())
                .errorSource(entity.getErrorSource())
                .httpStatusCode(entity.getHttpStatusCode())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .amountUsd(entity.getAmountUsd())
                .providerTransactionId(entity.getProviderTransactionId())
                .providerStatus(entity.getProviderStatus())
                .latencyMs(entity.getLatencyMs())
                .normalizationMethod(entity.getNormalizationMethod())
                .confidenceScore(entity.getConfidenceScore())
                .rawData(entity.getRawData())
                .metadata(entity.getMetadata())
                .createdAt(entity.getCreatedAt())
                .normalizedAt(entity.getNormalizedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
