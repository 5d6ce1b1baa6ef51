package com.payment.observability.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a normalized event was produced.
 */
public enum NormalizationMethod {
    AI_BASED("ai_based"),
    RULE_BASED("rule_based"),
    HYBRID("hybrid"),
    MANUAL("manual"),
    FALLBACK("fallback");

    private final String value;

    NormalizationMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
