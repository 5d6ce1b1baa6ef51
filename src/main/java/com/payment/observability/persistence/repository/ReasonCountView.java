package com.payment.observability.persistence.repository;

import com.payment.observability.domain.FailureReason;

public interface ReasonCountView {

    FailureReason getReason();

    Long getTotal();
}
