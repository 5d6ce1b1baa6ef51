package com.payment.observability.core;

/**
 * Keys the ingestion worker merges into a provider payload from the raw record's merchant data.
 */
public final class EnrichmentFields {

    public static final String TRANSACTIONAL_ID = "transactional_id";
    public static final String MERCHANT_ID = "merchant_id";
    public static final String MERCHANT_NAME = "merchant_name";
    public static final String MERCHANT_COUNTRY = "merchant_country";

    public static final String UNKNOWN_MERCHANT = "unknown_merchant";
    public static final String UNKNOWN_COUNTRY = "XX";

    private EnrichmentFields() {}
}
