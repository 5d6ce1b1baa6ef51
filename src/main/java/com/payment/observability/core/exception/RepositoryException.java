package com.payment.observability.core.exception;

/**
 * Persistence of a normalized event failed. Always fatal for the event being processed.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
