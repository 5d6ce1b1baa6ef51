package com.payment.observability.core.exception;

public class RateLimitExceededException extends AiServiceException {

    /** Seconds the provider asked us to wait, null when it gave no hint. */
    private final Long retryAfterSeconds;

    public RateLimitExceededException(String message, Long retryAfterSeconds, Throwable cause) {
        super(message, "RATE_LIMIT_EXCEEDED", cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
