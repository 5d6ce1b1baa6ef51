package com.payment.observability.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical status category shared by every provider after normalization.
 */
public enum PaymentStatus {
    APPROVED("approved"),
    FAILED("failed"),
    PENDING("pending"),
    CANCELLED("cancelled"),
    REFUNDED("refunded"),
    /** Stored but not yet normalized. */
    UNPROCESSED("unprocessed");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PaymentStatus fromValue(String value) {
        for (PaymentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + value);
    }
}
