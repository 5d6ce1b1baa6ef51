package com.payment.observability.api;

import com.payment.observability.core.IngestionOrchestrator;
import com.payment.observability.core.PaymentEventStore;
import com.payment.observability.core.exception.AiServiceException;
import com.payment.observability.core.exception.RateLimitExceededException;
import com.payment.observability.core.exception.RepositoryException;
import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for EventController using MockMvc.
 */
@WebMvcTest(controllers = EventController.class)
class EventControllerTest {

    private static final UUID EVENT_ID = UUID.fromString("6f1c2a7e-1b7d-4c8e-9a51-2f0d3e4b5c6d");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private IngestionOrchestrator orchestrator;

    @MockitoBean
    private PaymentEventStore eventStore;

    private static NormalizedPaymentEvent stripeEvent() {
        return NormalizedPaymentEvent.builder()
                .id(EVENT_ID)
                .provider("stripe")
                .merchantName("unknown_merchant")
                .country("XX")
                .statusCategory(PaymentStatus.APPROVED)
                .normalizationMethod(NormalizationMethod.RULE_BASED)
                .confidenceScore(0.85)
                .build();
    }

    @Test
    void ingestReturnsCreatedWithNormalizationSummary() throws Exception {
        when(orchestrator.ingest(any(), eq("stripe"))).thenReturn(stripeEvent());

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "rawEvent": {"id": "pi_1", "object": "payment_intent", "amount": 5000, "currency": "usd", "status": "succeeded"},
                                  "provider": "stripe"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(EVENT_ID.toString()))
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.normalizationMethod").value("rule_based"))
                .andExpect(jsonPath("$.confidenceScore").value(0.85));
    }

    @Test
    void emptyRawEventIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawEvent\": {}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.rawEvent").exists());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawEvent\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void normalizationFailureReturnsServerErrorWithCause() throws Exception {
        when(orchestrator.ingest(any(), isNull())).thenThrow(new AiServiceException("Model gpt-4o-mini call failed: 503", null));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawEvent\": {\"ref\": \"x-1\"}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("NORMALIZATION_FAILED"))
                .andExpect(jsonPath("$.message").value("Failed to ingest event: Model gpt-4o-mini call failed: 503"));
    }

    @Test
    void rateLimitIncludesRetryAfter() throws Exception {
        when(orchestrator.ingest(any(), any())).thenThrow(new RateLimitExceededException("rate limit exceeded", 30L, null));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawEvent\": {\"ref\": \"x-1\"}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.retryAfterSeconds").value(30));
    }

    @Test
    void persistenceFailureReturnsServerError() throws Exception {
        when(orchestrator.ingest(any(), any())).thenThrow(new RepositoryException("Failed to save normalized event", null));

        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rawEvent\": {\"ref\": \"x-1\"}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("PERSISTENCE_FAILED"));
    }

    @Test
    void getByIdReturnsEventOrNotFound() throws Exception {
        when(eventStore.findById(EVENT_ID)).thenReturn(Optional.of(stripeEvent()));
        UUID missing = UUID.randomUUID();
        when(eventStore.findById(missing)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/events/{id}", EVENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.provider").value("stripe"))
                .andExpect(jsonPath("$.statusCategory").value("approved"));
        mockMvc.perform(get("/api/v1/events/{id}", missing))
                .andExpect(status().isNotFound());
    }

    @Test
    void searchPassesParsedFilters() throws Exception {
        when(eventStore.findByFilters(eq("adyen"), eq(PaymentStatus.FAILED), isNull(), eq("BR"), eq(20), eq(40)))
                .thenReturn(List.of(stripeEvent()));

        mockMvc.perform(get("/api/v1/events")
                        .param("provider", "adyen")
                        .param("status", "failed")
                        .param("country", "br")
                        .param("limit", "20")
                        .param("offset", "40"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void searchRejectsInvalidPaging() throws Exception {
        mockMvc.perform(get("/api/v1/events").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void statusCountsCoverEveryStatus() throws Exception {
        when(eventStore.countByStatus(any())).thenReturn(0L);
        when(eventStore.countByStatus(PaymentStatus.APPROVED)).thenReturn(12L);

        mockMvc.perform(get("/api/v1/events/stats/status-counts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(12))
                .andExpect(jsonPath("$.unprocessed").value(0));

        verify(eventStore).countByStatus(PaymentStatus.REFUNDED);
    }
}
