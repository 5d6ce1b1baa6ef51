package com.payment.observability.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CurrencyConverterTest {

    @Test
    void convertsWithHalfUpRoundingToCents() {
        assertThat(CurrencyConverter.toUsd(new BigDecimal("100.00"), "EUR")).isEqualByComparingTo("110.00");
        assertThat(CurrencyConverter.toUsd(new BigDecimal("1000"), "mxn")).isEqualByComparingTo("58.00");
        assertThat(CurrencyConverter.toUsd(new BigDecimal("10.05"), "GBP")).isEqualByComparingTo("12.76");
        assertThat(CurrencyConverter.toUsd(new BigDecimal("50000"), "COP")).isEqualByComparingTo("12.50");
    }

    @Test
    void unknownOrMissingInputsYieldNull() {
        assertThat(CurrencyConverter.toUsd(new BigDecimal("10"), "XYZ")).isNull();
        assertThat(CurrencyConverter.toUsd(null, "USD")).isNull();
        assertThat(CurrencyConverter.toUsd(BigDecimal.ONE, null)).isNull();
        assertThat(CurrencyConverter.getExchangeRate("chf")).isNull();
    }

    @Test
    void exposesSupportedCurrencies() {
        assertThat(CurrencyConverter.getSupportedCurrencies()).contains("USD", "BRL", "ARS", "JPY").hasSize(13);
    }
}
