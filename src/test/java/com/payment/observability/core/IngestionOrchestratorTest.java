package com.payment.observability.core;

import com.payment.observability.adapters.AdyenMapper;
import com.payment.observability.adapters.MercadoPagoMapper;
import com.payment.observability.adapters.StripeMapper;
import com.payment.observability.core.exception.AiServiceException;
import com.payment.observability.core.exception.RepositoryException;
import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import com.payment.observability.messaging.NormalizedEventProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for IngestionOrchestrator (path selection and persistence).
 */
@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    @Mock
    private AiBasedNormalizer aiBasedNormalizer;
    @Mock
    private PaymentEventStore eventStore;
    @Mock
    private NormalizedEventProducer eventProducer;

    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        RuleBasedNormalizer ruleBasedNormalizer =
                new RuleBasedNormalizer(List.of(new StripeMapper(), new AdyenMapper(), new MercadoPagoMapper()));
        orchestrator = new IngestionOrchestrator(ruleBasedNormalizer, aiBasedNormalizer, eventStore, eventProducer);
    }

    private static Map<String, Object> stripeCharge() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "ch_1");
        raw.put("object", "charge");
        raw.put("amount", 1999);
        raw.put("currency", "usd");
        raw.put("status", "succeeded");
        return raw;
    }

    @Test
    void recognizedPayloadUsesRulesAndNeverCallsAi() {
        when(eventStore.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        NormalizedPaymentEvent saved = orchestrator.ingest(stripeCharge(), "stripe");

        assertThat(saved.getNormalizationMethod()).isEqualTo(NormalizationMethod.RULE_BASED);
        assertThat(saved.getProvider()).isEqualTo("stripe");
        verifyNoInteractions(aiBasedNormalizer);
        verify(eventProducer).publish(saved);
    }

    @Test
    void unrecognizedPayloadFallsBackToAi() {
        Map<String, Object> raw = Map.of("transaction_ref", "sq-9", "outcome", "ok");
        NormalizedPaymentEvent aiEvent = NormalizedPaymentEvent.builder()
                .id(UUID.randomUUID())
                .provider("square")
                .merchantName("unknown_merchant")
                .country("XX")
                .statusCategory(PaymentStatus.APPROVED)
                .normalizationMethod(NormalizationMethod.AI_BASED)
                .confidenceScore(0.95)
                .build();
        when(aiBasedNormalizer.normalize(raw)).thenReturn(aiEvent);
        when(eventStore.save(aiEvent)).thenReturn(aiEvent);

        NormalizedPaymentEvent saved = orchestrator.ingest(raw, null);

        assertThat(saved).isSameAs(aiEvent);
        verify(eventProducer).publish(aiEvent);
    }

    @Test
    void nothingIsStoredWhenNormalizationFails() {
        when(aiBasedNormalizer.normalize(anyMap())).thenThrow(new AiServiceException("model down", null));

        assertThatThrownBy(() -> orchestrator.ingest(Map.of("unknown", true), null))
                .isInstanceOf(AiServiceException.class);

        verify(eventStore, never()).save(any());
        verifyNoInteractions(eventProducer);
    }

    @Test
    void persistenceFailurePropagatesWithoutPublishing() {
        when(eventStore.save(any())).thenThrow(new RepositoryException("db down", null));

        assertThatThrownBy(() -> orchestrator.ingest(stripeCharge(), null)).isInstanceOf(RepositoryException.class);

        verifyNoInteractions(eventProducer);
    }

    @Test
    void emptyPayloadIsRejected() {
        assertThatThrownBy(() -> orchestrator.ingest(Map.of(), null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.ingest(null, null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(eventStore, eventProducer, aiBasedNormalizer);
    }
}
