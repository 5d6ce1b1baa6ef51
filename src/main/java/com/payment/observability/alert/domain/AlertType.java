package com.payment.observability.alert.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    PROVIDER_FAILURE("provider_failure"),
    PROVIDER_DEGRADED("provider_degraded"),
    COUNTRY_CONVERSION_DROP("country_conversion_drop"),
    ERROR_SPIKE("error_spike"),
    /** Also used for the informational "operating normally" system check. */
    HIGH_ERROR_RATE("high_error_rate");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
