package com.payment.observability.persistence.repository;

import com.payment.observability.domain.PaymentStatus;
import com.payment.observability.persistence.entity.NormalizedPaymentEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Normalized events plus the windowed aggregates used by alert detection.
 * All windows are half-open: {@code start <= createdAt < end}.
 */
@Repository
public interface NormalizedPaymentEventRepository extends JpaRepository<NormalizedPaymentEventEntity, UUID>,
        JpaSpecificationExecutor<NormalizedPaymentEventEntity> {

    String APPROVED_SUM = "SUM(CASE WHEN e.statusCategory = com.payment.observability.domain.PaymentStatus.APPROVED "
            + "THEN 1 ELSE 0 END)";

    Optional<NormalizedPaymentEventEntity> findFirstByProviderTransactionIdOrderByCreatedAtDesc(String providerTransactionId);

    List<NormalizedPaymentEventEntity> findByStatusCategoryOrderByCreatedAtAsc(PaymentStatus statusCategory, Pageable pageable);

    long countByStatusCategory(PaymentStatus statusCategory);

    @Query("SELECT COUNT(e) AS total, " + APPROVED_SUM + " AS approved FROM NormalizedPaymentEventEntity e "
            + "WHERE e.createdAt >= :start AND e.createdAt < :end")
    WindowTotalsView aggregateWindow(@Param("start") Instant start, @Param("end") Instant end);

    @Query("SELECT e.provider AS dimension, COUNT(e) AS total, " + APPROVED_SUM + " AS approved "
            + "FROM NormalizedPaymentEventEntity e WHERE e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.provider ORDER BY COUNT(e) DESC")
    List<DimensionCountView> aggregateByProvider(@Param("start") Instant start, @Param("end") Instant end);

    @Query("SELECT e.country AS dimension, COUNT(e) AS total, " + APPROVED_SUM + " AS approved "
            + "FROM NormalizedPaymentEventEntity e WHERE e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.country ORDER BY COUNT(e) DESC")
    List<DimensionCountView> aggregateByCountry(@Param("start") Instant start, @Param("end") Instant end);

    @Query("SELECT e.merchantName AS dimension, COUNT(e) AS total, " + APPROVED_SUM + " AS approved "
            + "FROM NormalizedPaymentEventEntity e WHERE e.provider = :provider "
            + "AND e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.merchantName ORDER BY COUNT(e) DESC")
    List<DimensionCountView> aggregateMerchantsForProvider(@Param("provider") String provider,
                                                           @Param("start") Instant start,
                                                           @Param("end") Instant end,
                                                           Pageable pageable);

    @Query("SELECT e.country AS dimension, COUNT(e) AS total, " + APPROVED_SUM + " AS approved "
            + "FROM NormalizedPaymentEventEntity e WHERE e.provider = :provider "
            + "AND e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.country ORDER BY COUNT(e) DESC")
    List<DimensionCountView> aggregateCountriesForProvider(@Param("provider") String provider,
                                                           @Param("start") Instant start,
                                                           @Param("end") Instant end,
                                                           Pageable pageable);

    @Query("SELECT e.failureReason AS reason, COUNT(e) AS total FROM NormalizedPaymentEventEntity e "
            + "WHERE e.failureReason IS NOT NULL AND e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.failureReason ORDER BY COUNT(e) DESC")
    List<ReasonCountView> countFailureReasons(@Param("start") Instant start, @Param("end") Instant end);

    @Query("SELECT e.failureReason AS reason, COUNT(e) AS total FROM NormalizedPaymentEventEntity e "
            + "WHERE e.provider = :provider AND e.failureReason IS NOT NULL "
            + "AND e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.failureReason ORDER BY COUNT(e) DESC")
    List<ReasonCountView> countFailureReasonsForProvider(@Param("provider") String provider,
                                                         @Param("start") Instant start,
                                                         @Param("end") Instant end,
                                                         Pageable pageable);

    @Query("SELECT e.errorSource AS source, COUNT(e) AS total FROM NormalizedPaymentEventEntity e "
            + "WHERE e.errorSource IS NOT NULL AND e.createdAt >= :start AND e.createdAt < :end "
            + "GROUP BY e.errorSource ORDER BY COUNT(e) DESC")
    List<ErrorSourceCountView> countErrorSources(@Param("start") Instant start, @Param("end") Instant end);
}
