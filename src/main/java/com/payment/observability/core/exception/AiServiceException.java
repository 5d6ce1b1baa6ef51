package com.payment.observability.core.exception;

/**
 * Language model call failed after retries and failover.
 */
public class AiServiceException extends NormalizationException {

    public AiServiceException(String message, Throwable cause) {
        super(message, "AI_SERVICE_ERROR", cause);
    }

    protected AiServiceException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
