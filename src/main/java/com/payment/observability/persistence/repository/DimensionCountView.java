package com.payment.observability.persistence.repository;

/**
 * Event and approval counts grouped by one dimension (provider, merchant or country).
 */
public interface DimensionCountView {

    String getDimension();

    Long getTotal();

    Long getApproved();
}
