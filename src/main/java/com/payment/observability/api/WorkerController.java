package com.payment.observability.api;

import com.payment.observability.core.RawEventSource;
import com.payment.observability.ingestion.BatchProcessingReport;
import com.payment.observability.ingestion.DataLakeIngestionWorker;
import com.payment.observability.ingestion.WorkerStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator controls for the data-lake ingestion worker.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/worker")
@RequiredArgsConstructor
@Tag(name = "Worker", description = "Start, stop and inspect the background ingestion worker")
public class WorkerController {

    private final DataLakeIngestionWorker worker;
    private final RawEventSource rawEventSource;

    @PostMapping("/start")
    @Operation(summary = "Start worker", description = "Starts periodic ingestion; no-op when already running")
    public ResponseEntity<WorkerStatus> start() {
        worker.start();
        return ResponseEntity.ok(worker.getStatus());
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop worker", description = "Stops scheduling; a cycle in flight is allowed to finish")
    public ResponseEntity<WorkerStatus> stop() {
        worker.stop();
        return ResponseEntity.ok(worker.getStatus());
    }

    @PostMapping("/run-once")
    @Operation(summary = "Run one cycle", description = "Processes one batch synchronously; skipped when a cycle is already in flight")
    public ResponseEntity<BatchProcessingReport> runOnce() {
        return ResponseEntity.ok(worker.runOnce());
    }

    @GetMapping("/status")
    @Operation(summary = "Worker status", description = "Worker state, last cycle report and raw source health")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("worker", worker.getStatus());
        boolean healthy = rawEventSource.isHealthy();
        body.put("dataLakeHealthy", healthy);
        if (healthy) {
            try {
                body.put("pendingRecords", rawEventSource.countRecords(false));
                body.put("processedRecords", rawEventSource.countRecords(true));
            } catch (RuntimeException e) {
                log.warn("Raw record counts unavailable: {}", e.getMessage());
            }
        }
        return ResponseEntity.ok(body);
    }
}
