package com.payment.observability.alert.api;

import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.alert.domain.AlertSeverity;
import com.payment.observability.alert.domain.AlertSummary;
import com.payment.observability.alert.engine.AlertMonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * On-demand alert detection over the normalized-event store.
 */
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Provider, conversion and error-spike alerts over recent payment events")
public class AlertController {

    private final AlertMonitoringService monitoringService;

    @GetMapping
    @Operation(summary = "Detect alerts",
            description = "Evaluates the last windowHours hours (1-168). Alerts are stored in the recent list and "
                    + "published to Kafka; critical alerts are sent to the notifier when notify=true.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert summary with counts by severity and type"),
            @ApiResponse(responseCode = "400", description = "windowHours out of range or unknown severity")
    })
    public ResponseEntity<AlertSummary> detect(
            @RequestParam(defaultValue = "1") int windowHours,
            @Parameter(description = "critical, warning or info") @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "false") boolean notify) {
        AlertSeverity filter = severity == null || severity.isBlank() ? null : AlertSeverity.fromValue(severity);
        return ResponseEntity.ok(monitoringService.detect(windowHours, filter, notify));
    }

    @GetMapping("/top-issues")
    @Operation(summary = "Top issues", description = "Critical and warning alerts, critical first")
    public ResponseEntity<List<AlertEvent>> topIssues(
            @RequestParam(defaultValue = "24") int windowHours,
            @RequestParam(defaultValue = "5") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(monitoringService.topIssues(windowHours, limit));
    }

    @GetMapping("/recent")
    @Operation(summary = "Recent alerts", description = "Alerts from previous detection runs, newest first (in-memory)")
    public ResponseEntity<List<AlertEvent>> recent(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(monitoringService.recent(limit));
    }
}
