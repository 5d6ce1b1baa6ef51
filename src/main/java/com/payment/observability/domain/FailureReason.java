package com.payment.observability.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed catalog of failure causes. Each reason carries the error source assumed when the
 * provider payload does not say who is responsible.
 */
public enum FailureReason {
    // customer side
    INSUFFICIENT_FUNDS("insufficient_funds", ErrorSource.CUSTOMER),
    CARD_DECLINED("card_declined", ErrorSource.CUSTOMER),
    EXPIRED_CARD("expired_card", ErrorSource.CUSTOMER),
    INVALID_CARD("invalid_card", ErrorSource.CUSTOMER),
    BANK_DECLINE("bank_decline", ErrorSource.CUSTOMER),
    // risk and security
    FRAUD_SUSPECTED("fraud_suspected", ErrorSource.PROVIDER),
    SECURITY_VIOLATION("security_violation", ErrorSource.PROVIDER),
    BLOCKED_CARD("blocked_card", ErrorSource.CUSTOMER),
    // technical
    NETWORK_ERROR("network_error", ErrorSource.NETWORK),
    TIMEOUT("timeout", ErrorSource.NETWORK),
    PROVIDER_ERROR("provider_error", ErrorSource.PROVIDER),
    SYSTEM_ERROR("system_error", ErrorSource.SYSTEM),
    // merchant configuration
    INVALID_MERCHANT("invalid_merchant", ErrorSource.MERCHANT),
    MERCHANT_NOT_ACTIVE("merchant_not_active", ErrorSource.MERCHANT),
    CONFIGURATION_ERROR("configuration_error", ErrorSource.MERCHANT),
    // business rules
    DUPLICATE_TRANSACTION("duplicate_transaction", ErrorSource.SYSTEM),
    AMOUNT_EXCEEDED("amount_exceeded", ErrorSource.CUSTOMER),
    INVALID_CURRENCY("invalid_currency", ErrorSource.MERCHANT),
    UNKNOWN("unknown", ErrorSource.UNKNOWN),
    NOT_APPLICABLE("not_applicable", null);

    private final String value;
    private final ErrorSource defaultErrorSource;

    FailureReason(String value, ErrorSource defaultErrorSource) {
        this.value = value;
        this.defaultErrorSource = defaultErrorSource;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** May be null for {@link #NOT_APPLICABLE}. */
    public ErrorSource getDefaultErrorSource() {
        return defaultErrorSource;
    }

    @JsonCreator
    public static FailureReason fromValue(String value) {
        for (FailureReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value) || reason.name().equalsIgnoreCase(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown failure reason: " + value);
    }
}
