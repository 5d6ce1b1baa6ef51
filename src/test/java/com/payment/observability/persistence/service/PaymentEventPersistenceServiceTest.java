package com.payment.observability.persistence.service;

import com.payment.observability.core.exception.RepositoryException;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import com.payment.observability.persistence.entity.NormalizedPaymentEventEntity;
import com.payment.observability.persistence.repository.NormalizedPaymentEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PaymentEventPersistenceService with a mocked repository.
 */
@ExtendWith(MockitoExtension.class)
class PaymentEventPersistenceServiceTest {

    @Mock
    private NormalizedPaymentEventRepository repository;

    private PaymentEventPersistenceService service;

    @BeforeEach
    void setUp() {
        service = new PaymentEventPersistenceService(repository);
    }

    private static NormalizedPaymentEvent event() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        return NormalizedPaymentEvent.builder()
                .id(UUID.randomUUID())
                .merchantName("Acme")
                .provider("adyen")
                .country("DE")
                .statusCategory(PaymentStatus.FAILED)
                .failureReason(FailureReason.EXPIRED_CARD)
                .errorSource(FailureReason.EXPIRED_CARD.getDefaultErrorSource())
                .amount(new BigDecimal("10.00"))
                .currency("EUR")
                .amountUsd(new BigDecimal("11.00"))
                .providerTransactionId("psp-1")
                .normalizationMethod(NormalizationMethod.RULE_BASED)
                .confidenceScore(0.8)
                .rawData(Map.of("pspReference", "psp-1"))
                .metadata(Map.of("mapper_used", "AdyenMapper"))
                .createdAt(now)
                .normalizedAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    void saveMapsEveryFieldBothWays() {
        when(repository.save(any(NormalizedPaymentEventEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        NormalizedPaymentEvent event = event();

        NormalizedPaymentEvent saved = service.save(event);

        assertThat(saved).usingRecursiveComparison().isEqualTo(event);
    }

    @Test
    void storageFailureIsWrapped() {
        when(repository.save(any(NormalizedPaymentEventEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.save(event()))
                .isInstanceOf(RepositoryException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    @SuppressWarnings("unchecked")
    void filterQuerySkipsOffsetWithinFetchedWindow() {
        NormalizedPaymentEventEntity first = NormalizedPaymentEventEntity.builder().id(UUID.randomUUID()).provider("adyen").build();
        NormalizedPaymentEventEntity second = NormalizedPaymentEventEntity.builder().id(UUID.randomUUID()).provider("adyen").build();
        NormalizedPaymentEventEntity third = NormalizedPaymentEventEntity.builder().id(UUID.randomUUID()).provider("adyen").build();
        when(repository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(first, second, third)));

        List<NormalizedPaymentEvent> page = service.findByFilters("Adyen", PaymentStatus.FAILED, null, "de", 2, 1);

        assertThat(page).extracting(NormalizedPaymentEvent::getId).containsExactly(second.getId(), third.getId());
        verify(repository).findAll(any(Specification.class), argThat((Pageable p) -> p.getPageSize() == 3 && p.getPageNumber() == 0));
    }

    @Test
    void unprocessedEventsAreReadOldestFirstWithinLimit() {
        NormalizedPaymentEventEntity older = NormalizedPaymentEventEntity.builder()
                .id(UUID.randomUUID()).statusCategory(PaymentStatus.UNPROCESSED).build();
        NormalizedPaymentEventEntity newer = NormalizedPaymentEventEntity.builder()
                .id(UUID.randomUUID()).statusCategory(PaymentStatus.UNPROCESSED).build();
        when(repository.findByStatusCategoryOrderByCreatedAtAsc(eq(PaymentStatus.UNPROCESSED), any(Pageable.class)))
                .thenReturn(List.of(older, newer));

        List<NormalizedPaymentEvent> unprocessed = service.findUnprocessed(2);

        assertThat(unprocessed).extracting(NormalizedPaymentEvent::getId).containsExactly(older.getId(), newer.getId());
        verify(repository).findByStatusCategoryOrderByCreatedAtAsc(eq(PaymentStatus.UNPROCESSED),
                argThat((Pageable p) -> p.getPageSize() == 2));
    }
}
