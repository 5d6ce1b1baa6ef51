package com.payment.observability.ingestion;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkerStatus {

    WorkerState state;
    boolean cycleInFlight;
    long intervalSeconds;
    int batchSize;
    long completedCycles;
    long skippedTicks;
    BatchProcessingReport lastReport;
}
