package com.payment.observability.core.exception;

public class NormalizationTimeoutException extends AiServiceException {

    private final int timeoutSeconds;

    public NormalizationTimeoutException(String message, int timeoutSeconds, Throwable cause) {
        super(message, "NORMALIZATION_TIMEOUT", cause);
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
