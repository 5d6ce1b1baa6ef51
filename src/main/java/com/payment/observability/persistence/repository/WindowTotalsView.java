package com.payment.observability.persistence.repository;

public interface WindowTotalsView {

    Long getTotal();

    /** Null when the window has no events. */
    Long getApproved();
}
