package com.payment.observability.alert.domain;

import com.payment.observability.domain.FailureReason;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FailureReasonCount {

    FailureReason reason;
    long count;
}
