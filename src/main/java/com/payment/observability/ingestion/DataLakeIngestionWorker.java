package com.payment.observability.ingestion;

import com.payment.observability.core.EnrichmentFields;
import com.payment.observability.core.IngestionIdempotencyService;
import com.payment.observability.core.IngestionOrchestrator;
import com.payment.observability.core.PayloadValues;
import com.payment.observability.core.RawEventSource;
import com.payment.observability.domain.MerchantDescriptor;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.RawIngestionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the data lake for raw events and feeds them through the {@link IngestionOrchestrator}.
 * <p>
 * A scheduler ticks at a fixed rate and hands each cycle to a dedicated thread. At most one cycle runs
 * at a time: a tick that finds a cycle in flight is dropped, not queued. A failing record is logged and
 * left unacknowledged; it never aborts the rest of the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataLakeIngestionWorker implements SmartLifecycle {

    private final RawEventSource rawEventSource;
    private final IngestionOrchestrator orchestrator;
    private final IngestionIdempotencyService idempotencyService;

    @Value("${payment.worker.interval-seconds:60}")
    private long intervalSeconds;

    @Value("${payment.worker.batch-size:100}")
    private int batchSize;

    @Value("${payment.worker.auto-start:false}")
    private boolean autoStart;

    @Value("${payment.worker.shutdown-timeout-seconds:120}")
    private long shutdownTimeoutSeconds;

    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();

    private volatile WorkerState state = WorkerState.STOPPED;
    private volatile BatchProcessingReport lastReport;
    private ScheduledExecutorService scheduler;
    private ExecutorService cycleExecutor;

    @Override
    public synchronized void start() {
        if (state == WorkerState.RUNNING) {
            log.info("Ingestion worker already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "ingestion-scheduler"));
        cycleExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "ingestion-cycle"));
        scheduler.scheduleAtFixedRate(this::onTick, 0, intervalSeconds, TimeUnit.SECONDS);
        state = WorkerState.RUNNING;
        log.info("Ingestion worker started intervalSeconds={} batchSize={}", intervalSeconds, batchSize);
    }

    /**
     * Stops scheduling new cycles and waits for the cycle in flight, if any, to finish.
     */
    @Override
    public synchronized void stop() {
        if (state == WorkerState.STOPPED) {
            return;
        }
        state = WorkerState.STOPPED;
        scheduler.shutdownNow();
        cycleExecutor.shutdown();
        try {
            if (!cycleExecutor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Ingestion cycle still running after {}s, stopping anyway", shutdownTimeoutSeconds);
                cycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cycleExecutor.shutdownNow();
        }
        log.info("Ingestion worker stopped completedCycles={} skippedTicks={}", completedCycles.get(), skippedTicks.get());
    }

    @Override
    public boolean isRunning() {
        return state == WorkerState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    /**
     * Runs one cycle synchronously on the calling thread. Returns a skipped report when a scheduled
     * cycle is already in flight.
     */
    public BatchProcessingReport runOnce() {
        if (!cycleInFlight.compareAndSet(false, true)) {
            log.warn("Manual ingestion cycle skipped: another cycle is in flight");
            return BatchProcessingReport.skipped(Instant.now());
        }
        try {
            return processBatch();
        } finally {
            cycleInFlight.set(false);
        }
    }

    public WorkerStatus getStatus() {
        return WorkerStatus.builder()
                .state(state)
                .cycleInFlight(cycleInFlight.get())
                .intervalSeconds(intervalSeconds)
                .batchSize(batchSize)
                .completedCycles(completedCycles.get())
                .skippedTicks(skippedTicks.get())
                .lastReport(lastReport)
                .build();
    }

    void onTick() {
        if (!cycleInFlight.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.warn("Ingestion tick skipped: previous cycle still running");
            return;
        }
        try {
            cycleExecutor.execute(() -> {
                try {
                    processBatch();
                } catch (RuntimeException e) {
                    log.error("Ingestion cycle failed unexpectedly", e);
                } finally {
                    cycleInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            cycleInFlight.set(false);
            log.debug("Ingestion tick rejected, worker is stopping");
        }
    }

    BatchProcessingReport processBatch() {
        Instant startedAt = Instant.now();
        long startMs = System.currentTimeMillis();

        List<RawIngestionRecord> records;
        try {
            records = rawEventSource.getUnprocessedBatch(batchSize);
        } catch (RuntimeException e) {
            log.error("Failed to fetch raw records from data lake: {}", e.getMessage(), e);
            records = Collections.emptyList();
        }
        if (records.isEmpty()) {
            log.debug("No unprocessed raw records");
        } else {
            log.info("Processing batch of {} raw records", records.size());
        }

        List<String> processedIds = new ArrayList<>();
        int ingested = 0;
        int duplicates = 0;
        int failed = 0;
        for (RawIngestionRecord record : records) {
            try {
                if (idempotencyService.isAlreadyIngested(record.getId())) {
                    processedIds.add(record.getId());
                    duplicates++;
                    continue;
                }
                Map<String, Object> rawEvent = enrich(record);
                String providerHint = gatewayHint(rawEvent);
                NormalizedPaymentEvent event = orchestrator.ingest(rawEvent, providerHint);
                idempotencyService.markIngested(record.getId(), String.valueOf(event.getId()));
                processedIds.add(record.getId());
                ingested++;
            } catch (Exception e) {
                failed++;
                log.error("Failed to process raw record id={}: {}", record.getId(), e.getMessage(), e);
            }
        }

        int acknowledged = 0;
        if (!processedIds.isEmpty()) {
            try {
                acknowledged = rawEventSource.markProcessed(processedIds);
            } catch (Exception e) {
                log.error("Failed to acknowledge {} raw records; they will be fetched again: {}",
                        processedIds.size(), e.getMessage(), e);
            }
        }

        BatchProcessingReport report = BatchProcessingReport.builder()
                .fetched(records.size())
                .ingested(ingested)
                .duplicates(duplicates)
                .failed(failed)
                .acknowledged(acknowledged)
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - startMs)
                .build();
        lastReport = report;
        completedCycles.incrementAndGet();
        if (!records.isEmpty()) {
            log.info("Ingestion cycle done fetched={} ingested={} duplicates={} failed={} acknowledged={} tookMs={}",
                    report.getFetched(), ingested, duplicates, failed, acknowledged, report.getDurationMs());
        }
        return report;
    }

    /**
     * Copy of the provider payload with the record's merchant data and correlation id merged in.
     *
     * @throws IllegalArgumentException when the record carries no provider payload
     */
    static Map<String, Object> enrich(RawIngestionRecord record) {
        if (record.getData() == null || record.getData().isEmpty()) {
            throw new IllegalArgumentException("Raw record " + record.getId() + " has no provider payload");
        }
        Map<String, Object> rawEvent = new LinkedHashMap<>(record.getData());
        if (record.getTransactionalId() != null) {
            rawEvent.put(EnrichmentFields.TRANSACTIONAL_ID, record.getTransactionalId());
        }
        MerchantDescriptor merchant = record.getMerchant();
        if (merchant != null) {
            putIfPresent(rawEvent, EnrichmentFields.MERCHANT_ID, merchant.getId());
            putIfPresent(rawEvent, EnrichmentFields.MERCHANT_NAME, merchant.getName());
            putIfPresent(rawEvent, EnrichmentFields.MERCHANT_COUNTRY, merchant.getCountry());
        }
        return rawEvent;
    }

    /** Gateway name recorded by the source under {@code audit.gw}, if any. */
    static String gatewayHint(Map<String, Object> rawEvent) {
        return PayloadValues.string(PayloadValues.map(rawEvent, "audit"), "gw");
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
