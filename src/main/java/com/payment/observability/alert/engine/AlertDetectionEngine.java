package com.payment.observability.alert.engine;

import com.payment.observability.alert.domain.AlertEvent;
import com.payment.observability.alert.domain.AlertSeverity;
import com.payment.observability.alert.domain.AlertType;
import com.payment.observability.alert.domain.CountryConversionDrop;
import com.payment.observability.alert.domain.DimensionStats;
import com.payment.observability.alert.domain.FailureReasonCount;
import com.payment.observability.alert.features.PaymentWindowStatsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Evaluates the normalized-event store over the window {@code [now - H, now)} and reports provider
 * outages, conversion drops against the previous window, and failure-reason spikes.
 * Holds no state between calls.
 */
@Slf4j
@Service
public class AlertDetectionEngine {

    static final int MAX_AFFECTED = 5;
    static final int MAX_DEGRADED_MERCHANTS = 3;
    static final int MAX_TOP_FAILURES = 3;

    private final PaymentWindowStatsService stats;
    private final Clock clock;

    @Value("${payment.alerts.threshold.critical-success-rate:60.0}")
    private double criticalSuccessRate;
    @Value("${payment.alerts.threshold.warning-success-rate:80.0}")
    private double warningSuccessRate;
    @Value("${payment.alerts.threshold.healthy-success-rate:95.0}")
    private double healthySuccessRate;
    @Value("${payment.alerts.threshold.conversion-drop-percent:20.0}")
    private double conversionDropThreshold;
    @Value("${payment.alerts.threshold.country-drop-floor-percent:5.0}")
    private double countryDropFloor;
    @Value("${payment.alerts.threshold.critical-error-count:50}")
    private long criticalErrorCount;
    @Value("${payment.alerts.threshold.warning-error-count:20}")
    private long warningErrorCount;
    @Value("${payment.alerts.max-window-hours:168}")
    private int maxWindowHours;

    public AlertDetectionEngine(PaymentWindowStatsService stats, Clock clock) {
        this.stats = stats;
        this.clock = clock;
    }

    /**
     * Runs every detector over the last {@code windowHours} hours. Alerts come back in detection
     * order: provider, conversion drop, error spike, then the system health notice.
     */
    public List<AlertEvent> detectAll(int windowHours) {
        if (windowHours < 1 || windowHours > maxWindowHours) {
            throw new IllegalArgumentException("windowHours must be between 1 and " + maxWindowHours + ", got " + windowHours);
        }
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofHours(windowHours));
        DimensionStats overall = stats.overall(start, end);

        List<AlertEvent> alerts = new ArrayList<>();
        alerts.addAll(detectProviderAlerts(start, end, windowHours));
        detectConversionDrop(overall, start, end, windowHours).ifPresent(alerts::add);
        detectErrorSpike(start, end, windowHours).ifPresent(alerts::add);
        detectSystemHealth(overall, start, end, windowHours).ifPresent(alerts::add);

        log.info("Alert detection windowHours={} events={} alerts={} critical={}",
                windowHours, overall.getTotal(), alerts.size(),
                alerts.stream().filter(a -> a.getSeverity() == AlertSeverity.CRITICAL).count());
        return alerts;
    }

    /**
     * Critical and warning alerts, critical first; detection order is kept within a severity.
     */
    public List<AlertEvent> topIssues(int windowHours, int limit) {
        return detectAll(windowHours).stream()
                .filter(a -> a.getSeverity() != AlertSeverity.INFO)
                .sorted(Comparator.comparing(AlertEvent::getSeverity))
                .limit(limit)
                .toList();
    }

    List<AlertEvent> detectProviderAlerts(Instant start, Instant end, int windowHours) {
        List<AlertEvent> alerts = new ArrayList<>();
        for (DimensionStats provider : stats.byProvider(start, end)) {
            if (provider.getTotal() == 0) {
                continue;
            }
            double rate = provider.getSuccessRate();
            if (rate < criticalSuccessRate) {
                List<DimensionStats> merchants = stats.topMerchants(provider.getName(), start, end, MAX_AFFECTED);
                List<DimensionStats> countries = stats.topCountries(provider.getName(), start, end, MAX_AFFECTED);
                List<FailureReasonCount> failures = stats.topFailureReasons(provider.getName(), start, end, MAX_TOP_FAILURES);
                alerts.add(baseAlert(AlertSeverity.CRITICAL, AlertType.PROVIDER_FAILURE, start, end)
                        .title("Provider " + provider.getName() + " failing")
                        .message(String.format(Locale.ROOT,
                                "Success rate %.1f%% over the last %dh (%d of %d approved, %d failed) across %d merchants and %d countries",
                                rate, windowHours, provider.getApproved(), provider.getTotal(), provider.getFailed(),
                                merchants.size(), countries.size()))
                        .provider(provider.getName())
                        .successRate(round(rate))
                        .totalEvents(provider.getTotal())
                        .failedEvents(provider.getFailed())
                        .merchantsAffected(merchants)
                        .countriesAffected(countries)
                        .topFailures(failures)
                        .build());
            } else if (rate < warningSuccessRate) {
                List<DimensionStats> merchants = stats.topMerchants(provider.getName(), start, end, MAX_DEGRADED_MERCHANTS);
                alerts.add(baseAlert(AlertSeverity.WARNING, AlertType.PROVIDER_DEGRADED, start, end)
                        .title("Provider " + provider.getName() + " degraded")
                        .message(String.format(Locale.ROOT,
                                "Success rate %.1f%% over the last %dh (%d of %d approved)",
                                rate, windowHours, provider.getApproved(), provider.getTotal()))
                        .provider(provider.getName())
                        .successRate(round(rate))
                        .totalEvents(provider.getTotal())
                        .failedEvents(provider.getFailed())
                        .merchantsAffected(merchants)
                        .build());
            }
        }
        return alerts;
    }

    Optional<AlertEvent> detectConversionDrop(DimensionStats current, Instant start, Instant end, int windowHours) {
        Instant previousStart = start.minus(Duration.ofHours(windowHours));
        DimensionStats previous = stats.overall(previousStart, start);
        if (current.getTotal() == 0 || previous.getTotal() == 0 || previous.getSuccessRate() <= 0) {
            return Optional.empty();
        }
        double drop = relativeDrop(previous.getSuccessRate(), current.getSuccessRate());
        if (drop <= conversionDropThreshold) {
            return Optional.empty();
        }
        List<CountryConversionDrop> countryAnalysis = rankCountryDrops(
                stats.byCountry(start, end), stats.byCountry(previousStart, start), countryDropFloor);
        return Optional.of(baseAlert(AlertSeverity.CRITICAL, AlertType.COUNTRY_CONVERSION_DROP, start, end)
                .title("Conversion dropped " + String.format(Locale.ROOT, "%.1f%%", drop))
                .message(String.format(Locale.ROOT,
                        "Success rate fell from %.1f%% to %.1f%% compared with the previous %dh; %d countries affected",
                        previous.getSuccessRate(), current.getSuccessRate(), windowHours, countryAnalysis.size()))
                .successRate(round(current.getSuccessRate()))
                .previousSuccessRate(round(previous.getSuccessRate()))
                .dropPercentage(round(drop))
                .totalEvents(current.getTotal())
                .failedEvents(current.getFailed())
                .countryAnalysis(countryAnalysis)
                .previousWindowStart(previousStart)
                .build());
    }

    /**
     * Countries present in both windows whose relative success-rate drop exceeds {@code floorPercent},
     * largest drop first.
     */
    static List<CountryConversionDrop> rankCountryDrops(List<DimensionStats> current,
                                                        List<DimensionStats> previous,
                                                        double floorPercent) {
        Map<String, DimensionStats> previousByCountry = previous.stream()
                .collect(Collectors.toMap(DimensionStats::getName, Function.identity(), (a, b) -> a));
        List<CountryConversionDrop> drops = new ArrayList<>();
        for (DimensionStats now : current) {
            DimensionStats before = previousByCountry.get(now.getName());
            if (before == null || before.getTotal() == 0 || before.getSuccessRate() <= 0) {
                continue;
            }
            double drop = relativeDrop(before.getSuccessRate(), now.getSuccessRate());
            if (drop > floorPercent) {
                drops.add(CountryConversionDrop.builder()
                        .country(now.getName())
                        .previousSuccessRate(round(before.getSuccessRate()))
                        .currentSuccessRate(round(now.getSuccessRate()))
                        .dropPercentage(round(drop))
                        .currentTotal(now.getTotal())
                        .previousTotal(before.getTotal())
                        .build());
            }
        }
        drops.sort(Comparator.comparingDouble(CountryConversionDrop::getDropPercentage).reversed());
        return drops;
    }

    Optional<AlertEvent> detectErrorSpike(Instant start, Instant end, int windowHours) {
        List<FailureReasonCount> reasons = stats.failureReasons(start, end);
        if (reasons.isEmpty()) {
            return Optional.empty();
        }
        FailureReasonCount top = reasons.get(0);
        AlertSeverity severity;
        if (top.getCount() > criticalErrorCount) {
            severity = AlertSeverity.CRITICAL;
        } else if (top.getCount() > warningErrorCount) {
            severity = AlertSeverity.WARNING;
        } else {
            return Optional.empty();
        }
        return Optional.of(baseAlert(severity, AlertType.ERROR_SPIKE, start, end)
                .title("Spike in " + top.getReason().getValue() + " errors")
                .message(String.format(Locale.ROOT, "%d events failed with %s in the last %dh",
                        top.getCount(), top.getReason().getValue(), windowHours))
                .errorReason(top.getReason().getValue())
                .errorCount(top.getCount())
                .topFailures(reasons.subList(0, Math.min(MAX_TOP_FAILURES, reasons.size())))
                .errorSources(stats.errorSources(start, end))
                .build());
    }

    Optional<AlertEvent> detectSystemHealth(DimensionStats overall, Instant start, Instant end, int windowHours) {
        if (overall.getTotal() == 0 || overall.getSuccessRate() < healthySuccessRate) {
            return Optional.empty();
        }
        return Optional.of(baseAlert(AlertSeverity.INFO, AlertType.HIGH_ERROR_RATE, start, end)
                .title("Payment system operating normally")
                .message(String.format(Locale.ROOT, "Success rate %.1f%% across %d events in the last %dh",
                        overall.getSuccessRate(), overall.getTotal(), windowHours))
                .successRate(round(overall.getSuccessRate()))
                .totalEvents(overall.getTotal())
                .failedEvents(overall.getFailed())
                .build());
    }

    private AlertEvent.AlertEventBuilder baseAlert(AlertSeverity severity, AlertType type, Instant start, Instant end) {
        return AlertEvent.builder()
                .alertId(UUID.randomUUID().toString())
                .severity(severity)
                .type(type)
                .detectedAt(end)
                .windowStart(start)
                .windowEnd(end);
    }

    private static double relativeDrop(double previousRate, double currentRate) {
        return (previousRate - currentRate) / previousRate * 100.0;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
