package com.payment.observability.persistence.repository;

import com.payment.observability.domain.ErrorSource;

public interface ErrorSourceCountView {

    ErrorSource getSource();

    Long getTotal();
}
