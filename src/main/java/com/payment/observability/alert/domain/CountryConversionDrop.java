package com.payment.observability.alert.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Success-rate change of one country between the previous and the current window.
 */
@Value
@Builder
public class CountryConversionDrop {

    String country;
    double previousSuccessRate;
    double currentSuccessRate;
    /** Relative drop in percent: (previous - current) / previous * 100. */
    double dropPercentage;
    long currentTotal;
    long previousTotal;
}
