package com.payment.observability.ingestion;

public enum WorkerState {
    STOPPED,
    RUNNING
}
