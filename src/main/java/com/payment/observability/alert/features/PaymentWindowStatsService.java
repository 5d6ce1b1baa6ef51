package com.payment.observability.alert.features;

import com.payment.observability.alert.domain.DimensionStats;
import com.payment.observability.alert.domain.FailureReasonCount;
import com.payment.observability.persistence.repository.DimensionCountView;
import com.payment.observability.persistence.repository.ErrorSourceCountView;
import com.payment.observability.persistence.repository.NormalizedPaymentEventRepository;
import com.payment.observability.persistence.repository.ReasonCountView;
import com.payment.observability.persistence.repository.WindowTotalsView;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates over the normalized-event store for a half-open window {@code [start, end)}.
 * Query failures propagate to the caller.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PaymentWindowStatsService {

    private final NormalizedPaymentEventRepository repository;

    public DimensionStats overall(Instant start, Instant end) {
        WindowTotalsView totals = repository.aggregateWindow(start, end);
        long total = totals != null && totals.getTotal() != null ? totals.getTotal() : 0L;
        long approved = totals != null && totals.getApproved() != null ? totals.getApproved() : 0L;
        return DimensionStats.builder().name("all").total(total).approved(approved).build();
    }

    public List<DimensionStats> byProvider(Instant start, Instant end) {
        return toStats(repository.aggregateByProvider(start, end));
    }

    public List<DimensionStats> byCountry(Instant start, Instant end) {
        return toStats(repository.aggregateByCountry(start, end));
    }

    /** Merchants of one provider, by volume descending. */
    public List<DimensionStats> topMerchants(String provider, Instant start, Instant end, int limit) {
        return toStats(repository.aggregateMerchantsForProvider(provider, start, end, PageRequest.of(0, limit)));
    }

    public List<DimensionStats> topCountries(String provider, Instant start, Instant end, int limit) {
        return toStats(repository.aggregateCountriesForProvider(provider, start, end, PageRequest.of(0, limit)));
    }

    /** Failure reasons by count descending. */
    public List<FailureReasonCount> failureReasons(Instant start, Instant end) {
        return toReasonCounts(repository.countFailureReasons(start, end));
    }

    public List<FailureReasonCount> topFailureReasons(String provider, Instant start, Instant end, int limit) {
        return toReasonCounts(repository.countFailureReasonsForProvider(provider, start, end, PageRequest.of(0, limit)));
    }

    public Map<String, Long> errorSources(Instant start, Instant end) {
        Map<String, Long> sources = new LinkedHashMap<>();
        for (ErrorSourceCountView view : repository.countErrorSources(start, end)) {
            sources.put(view.getSource().getValue(), view.getTotal());
        }
        return sources;
    }

    private static List<DimensionStats> toStats(List<DimensionCountView> views) {
        return views.stream()
                .map(v -> DimensionStats.builder()
                        .name(v.getDimension())
                        .total(v.getTotal() != null ? v.getTotal() : 0L)
                        .approved(v.getApproved() != null ? v.getApproved() : 0L)
                        .build())
                .toList();
    }

    private static List<FailureReasonCount> toReasonCounts(List<ReasonCountView> views) {
        return views.stream()
                .map(v -> FailureReasonCount.builder().reason(v.getReason()).count(v.getTotal()).build())
                .toList();
    }
}
