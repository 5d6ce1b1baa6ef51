package com.payment.observability.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts amounts to USD using a static rate table. Unknown currencies yield null.
 */
public final class CurrencyConverter {

    private static final Map<String, BigDecimal> USD_RATES;

    static {
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        rates.put("USD", new BigDecimal("1.0"));
        rates.put("EUR", new BigDecimal("1.10"));
        rates.put("GBP", new BigDecimal("1.27"));
        rates.put("MXN", new BigDecimal("0.058"));
        rates.put("BRL", new BigDecimal("0.20"));
        rates.put("COP", new BigDecimal("0.00025"));
        rates.put("ARS", new BigDecimal("0.001"));
        rates.put("CLP", new BigDecimal("0.0011"));
        rates.put("PEN", new BigDecimal("0.27"));
        rates.put("CAD", new BigDecimal("0.74"));
        rates.put("AUD", new BigDecimal("0.65"));
        rates.put("JPY", new BigDecimal("0.0069"));
        rates.put("CNY", new BigDecimal("0.14"));
        USD_RATES = Collections.unmodifiableMap(rates);
    }

    private CurrencyConverter() {}

    /** Returns the USD equivalent rounded to cents, or null when amount, currency or rate is missing. */
    public static BigDecimal toUsd(BigDecimal amount, String currency) {
        if (amount == null || currency == null || currency.isBlank()) return null;
        BigDecimal rate = getExchangeRate(currency);
        if (rate == null) return null;
        return amount.multiply(rate).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal getExchangeRate(String currency) {
        if (currency == null) return null;
        return USD_RATES.get(currency.trim().toUpperCase());
    }

    public static Set<String> getSupportedCurrencies() {
        return USD_RATES.keySet();
    }
}
