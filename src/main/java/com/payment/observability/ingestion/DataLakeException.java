package com.payment.observability.ingestion;

/**
 * Query against the raw ingestion store failed.
 */
public class DataLakeException extends RuntimeException {

    public DataLakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
