package com.payment.observability.alert.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert severity. Declaration order is priority order: critical first.
 */
public enum AlertSeverity {
    CRITICAL("critical"),
    WARNING("warning"),
    INFO("info");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AlertSeverity fromValue(String value) {
        for (AlertSeverity severity : values()) {
            if (severity.value.equalsIgnoreCase(value) || severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: " + value);
    }
}
