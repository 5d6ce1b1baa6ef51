package com.payment.observability.alert.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AlertSummary {

    int windowHours;
    Instant generatedAt;
    int totalAlerts;
    Map<String, Long> bySeverity;
    Map<String, Long> byType;
    List<AlertEvent> alerts;
}
