package com.payment.observability.core.exception;

/**
 * Model answered but the output does not match the normalization schema. Never retried.
 */
public class ValidationException extends NormalizationException {

    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR", null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, "VALIDATION_ERROR", cause);
    }
}
