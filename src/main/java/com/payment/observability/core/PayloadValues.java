package com.payment.observability.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed reads from loosely structured JSON payloads (maps decoded by Jackson).
 */
public final class PayloadValues {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final Pattern ALPHA_2 = Pattern.compile("^[A-Za-z]{2}$");

    private PayloadValues() {}

    public static String string(Map<String, Object> source, String key) {
        if (source == null) return null;
        Object value = source.get(key);
        if (value == null) return null;
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    /** Nested object as a string-keyed copy, or null when the value is absent or not an object. */
    public static Map<String, Object> map(Map<String, Object> source, String key) {
        if (source == null) return null;
        Object value = source.get(key);
        if (!(value instanceof Map)) return null;
        Map<?, ?> nested = (Map<?, ?>) value;
        Map<String, Object> copy = new LinkedHashMap<>();
        nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    /** Numeric value as a decimal; strings are parsed and a malformed one raises NumberFormatException. */
    public static BigDecimal decimal(Map<String, Object> source, String key) {
        if (source == null) return null;
        Object value = source.get(key);
        if (value == null) return null;
        if (value instanceof BigDecimal) return (BigDecimal) value;
        if (value instanceof Number) return new BigDecimal(value.toString());
        String text = value.toString().trim();
        return text.isEmpty() ? null : new BigDecimal(text);
    }

    public static BigDecimal fromMinorUnits(BigDecimal minor) {
        if (minor == null) return null;
        return minor.divide(ONE_HUNDRED, 2, RoundingMode.HALF_UP);
    }

    public static BigDecimal toMoney(BigDecimal major) {
        if (major == null) return null;
        return major.setScale(2, RoundingMode.HALF_UP);
    }

    public static String upper(String value) {
        return value == null ? null : value.trim().toUpperCase();
    }

    /** Upper-cased ISO-3166 alpha-2 code, or null when the value is not two letters. */
    public static String countryCode(String value) {
        if (value == null) return null;
        String code = value.trim();
        return ALPHA_2.matcher(code).matches() ? code.toUpperCase() : null;
    }

    public static Instant epochSeconds(Map<String, Object> source, String key) {
        BigDecimal seconds = decimal(source, key);
        return seconds == null ? null : Instant.ofEpochSecond(seconds.longValue());
    }

    /** ISO-8601 timestamp with offset, e.g. 2024-01-15T10:30:00.000-04:00. */
    public static Instant isoTimestamp(Map<String, Object> source, String key) {
        String text = string(source, key);
        if (text == null) return null;
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.parse(text);
        }
    }
}
