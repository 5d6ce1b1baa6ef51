package com.payment.observability.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Party responsible for a failed payment.
 */
public enum ErrorSource {
    PROVIDER("provider"),
    MERCHANT("merchant"),
    CUSTOMER("customer"),
    SYSTEM("system"),
    NETWORK("network"),
    UNKNOWN("unknown");

    private final String value;

    ErrorSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ErrorSource fromValue(String value) {
        for (ErrorSource source : values()) {
            if (source.value.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown error source: " + value);
    }
}
