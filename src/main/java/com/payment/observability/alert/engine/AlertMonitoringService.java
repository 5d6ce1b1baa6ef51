package com.payment.observability.alert.engine;

import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.alert.domain.AlertSeverity;
import com.payment.observability.alert.domain.AlertSummary;
import com.payment.observability.alert.llm.AlertEnrichmentService;
import com.payment.observability.alert.messaging.AlertEventProducer;
import com.payment.observability.alert.messaging.AlertNotifier;
import com.payment.observability.alert.store.RecentAlertsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs detection and hands the result to enrichment, the recent-alerts store, Kafka and the notifier.
 * Everything after detection is best effort: a failing step is logged and the alert is still returned.
 */
@Slf4j
@Service
public class AlertMonitoringService {

    private final AlertDetectionEngine detectionEngine;
    private final AlertEnrichmentService enrichmentService;
    private final RecentAlertsStore recentAlertsStore;
    private final AlertEventProducer alertEventProducer;
    private final AlertNotifier notifier;
    private final Clock clock;

    @Value("${payment.alerts.enrichment.max-alerts:5}")
    private int maxEnrichedAlerts;

    public AlertMonitoringService(AlertDetectionEngine detectionEngine,
                                  AlertEnrichmentService enrichmentService,
                                  RecentAlertsStore recentAlertsStore,
                                  AlertEventProducer alertEventProducer,
                                  AlertNotifier notifier,
                                  Clock clock) {
        this.detectionEngine = detectionEngine;
        this.enrichmentService = enrichmentService;
        this.recentAlertsStore = recentAlertsStore;
        this.alertEventProducer = alertEventProducer;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Detects alerts over the last {@code windowHours}, optionally keeping only one severity, and sends
     * critical ones through the notifier when {@code notify} is set.
     */
    public AlertSummary detect(int windowHours, AlertSeverity severityFilter, boolean notify) {
        List<AlertEvent> alerts = detectionEngine.detectAll(windowHours);
        if (severityFilter != null) {
            alerts = alerts.stream().filter(a -> a.getSeverity() == severityFilter).toList();
        }
        alerts = enrich(alerts);
        for (AlertEvent alert : alerts) {
            recentAlertsStore.add(alert);
            alertEventProducer.send(alert);
        }
        if (notify) {
            alerts.stream()
                    .filter(a -> a.getSeverity() == AlertSeverity.CRITICAL)
                    .forEach(this::notifySafely);
        }
        return summarize(alerts, windowHours);
    }

    public List<AlertEvent> topIssues(int windowHours, int limit) {
        return detectionEngine.topIssues(windowHours, limit);
    }

    public List<AlertEvent> recent(int limit) {
        return recentAlertsStore.getRecent(limit);
    }

    AlertSummary summarize(List<AlertEvent> alerts, int windowHours) {
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (AlertSeverity severity : AlertSeverity.values()) {
            bySeverity.put(severity.getValue(), 0L);
        }
        alerts.forEach(a -> bySeverity.merge(a.getSeverity().getValue(), 1L, Long::sum));
        Map<String, Long> byType = alerts.stream()
                .collect(Collectors.groupingBy(a -> a.getType().getValue(), LinkedHashMap::new, Collectors.counting()));
        return AlertSummary.builder()
                .windowHours(windowHours)
                .generatedAt(clock.instant())
                .totalAlerts(alerts.size())
                .bySeverity(bySeverity)
                .byType(byType)
                .alerts(alerts)
                .build();
    }

    /** Critical alerts are enriched first; at most maxEnrichedAlerts model calls per run. */
    List<AlertEvent> enrich(List<AlertEvent> alerts) {
        List<AlertEvent> priority = alerts.stream()
                .filter(a -> a.getSeverity() != AlertSeverity.INFO)
                .sorted(Comparator.comparing(AlertEvent::getSeverity))
                .limit(maxEnrichedAlerts)
                .toList();
        if (priority.isEmpty()) {
            return alerts;
        }
        Map<String, String> explanations = new LinkedHashMap<>();
        for (AlertEvent alert : priority) {
            explain(alert).ifPresent(text -> explanations.put(alert.getAlertId(), text));
        }
        List<AlertEvent> enriched = new ArrayList<>(alerts.size());
        for (AlertEvent alert : alerts) {
            String text = explanations.get(alert.getAlertId());
            enriched.add(text == null ? alert : alert.toBuilder().detailedExplanation(text).build());
        }
        return enriched;
    }

    private Optional<String> explain(AlertEvent alert) {
        try {
            return enrichmentService.explain(alert);
        } catch (RuntimeException e) {
            log.warn("Enrichment failed for alert={}: {}", alert.getAlertId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void notifySafely(AlertEvent alert) {
        try {
            String messageId = notifier.sendAlert(alert);
            log.info("Notified alert={} via {} messageId={}", alert.getAlertId(), notifier.name(), messageId);
        } catch (RuntimeException e) {
            log.error("Notifier {} failed for alert={}", notifier.name(), alert.getAlertId(), e);
        }
    }
}
