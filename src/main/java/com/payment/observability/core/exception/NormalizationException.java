package com.payment.observability.core.exception;

/**
 * Raised when a raw payment event cannot be turned into a normalized event.
 */
public class NormalizationException extends RuntimeException {

    private final String errorCode;

    public NormalizationException(String message) {
        this(message, "NORMALIZATION_ERROR", null);
    }

    public NormalizationException(String message, Throwable cause) {
        this(message, "NORMALIZATION_ERROR", cause);
    }

    protected NormalizationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
