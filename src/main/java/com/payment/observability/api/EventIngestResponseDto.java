package com.payment.observability.api;

import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.NormalizedPaymentEvent;
import com.payment.observability.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class EventIngestResponseDto {

    UUID id;
    PaymentStatus status;
    NormalizationMethod normalizationMethod;
    double confidenceScore;
    String message;

    public static EventIngestResponseDto from(NormalizedPaymentEvent event) {
        return EventIngestResponseDto.builder()
                .id(event.getId())
                .status(event.getStatusCategory())
                .normalizationMethod(event.getNormalizationMethod())
                .confidenceScore(event.getConfidenceScore())
                .message("Event ingested from " + event.getProvider())
                .build();
    }
}
