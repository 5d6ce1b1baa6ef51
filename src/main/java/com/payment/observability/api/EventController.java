package com.payment.observability.api;

import com.payment.observability.core.IngestionOrchestrator;
import com.payment.observability.core.PaymentEventStore;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for on-demand ingestion and querying of normalized payment events.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Ingest raw provider events and query normalized ones")
public class EventController {

    private static final int MAX_PAGE_SIZE = 500;

    private final IngestionOrchestrator orchestrator;
    private final PaymentEventStore eventStore;

    @PostMapping
    @Operation(summary = "Ingest event",
            description = "Normalizes a raw Stripe, Adyen or Mercado Pago payload with the rule-based mappers, "
                    + "or with the AI normalizer for any other provider, and stores the result.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Event normalized and stored",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = EventIngestResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Empty or malformed body. Body: { \"error\": \"VALIDATION_FAILED\"|\"BAD_REQUEST\", ... }"),
            @ApiResponse(responseCode = "500", description = "Normalization or persistence failed. Body: { \"error\": \"NORMALIZATION_FAILED\"|\"PERSISTENCE_FAILED\", \"message\": \"...\" }")
    })
    public ResponseEntity<EventIngestResponseDto> ingest(@Valid @RequestBody EventIngestRequestDto dto) {
        NormalizedPaymentEvent event = orchestrator.ingest(dto.getRawEvent(), dto.getProvider());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventIngestResponseDto.from(event));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get event by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event found"),
            @ApiResponse(responseCode = "404", description = "No event with this id")
    })
    public ResponseEntity<NormalizedPaymentEvent> getById(@PathVariable UUID id) {
        return eventStore.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "Search events", description = "Newest first; all filters optional")
    public ResponseEntity<List<NormalizedPaymentEvent>> search(
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String merchant,
            @RequestParam(required = false) String country,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE || offset < 0) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE + " and offset non-negative");
        }
        PaymentStatus statusFilter = status == null || status.isBlank() ? null : PaymentStatus.fromValue(status);
        String countryFilter = country == null ? null : country.toUpperCase();
        return ResponseEntity.ok(eventStore.findByFilters(provider, statusFilter, merchant, countryFilter, limit, offset));
    }

    @GetMapping("/stats/status-counts")
    @Operation(summary = "Event counts per status")
    public ResponseEntity<Map<String, Long>> statusCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status.getValue(), eventStore.countByStatus(status));
        }
        return ResponseEntity.ok(counts);
    }
}
