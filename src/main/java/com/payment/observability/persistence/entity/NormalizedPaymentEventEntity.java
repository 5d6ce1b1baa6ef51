package com.payment.observability.persistence.entity;

import com.payment.observability.domain.ErrorSource;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.NormalizationMethod;
import com.payment.observability.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One normalized payment event. Indexes follow the alert engine's aggregate queries.
 */
@Entity
@Table(name = "normalized_payment_events", indexes = {
    @Index(name = "idx_created_at", columnList = "created_at"),
    @Index(name = "idx_provider_status", columnList = "provider, status_category"),
    @Index(name = "idx_merchant_country", columnList = "merchant_name, country"),
    @Index(name = "idx_analytics", columnList = "provider, status_category, created_at"),
    @Index(name = "idx_transactional_id", columnList = "transactional_id"),
    @Index(name = "idx_provider_transaction_id", columnList = "provider_transaction_id"),
    @Index(name = "idx_error_analysis", columnList = "error_source, failure_reason, status_category")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedPaymentEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "merchant_name", nullable = false)
    private String merchantName;

    @Column(name = "provider", nullable = false, length = 100)
    private String provider;

    @Column(name = "country", nullable = false, length = 2)
    private String country;

    @Column(name = "transactional_id")
    private String transactionalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_category", nullable = false, length = 20)
    private PaymentStatus statusCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 50)
    private FailureReason failureReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_source", length = 20)
    private ErrorSource errorSource;

    @Column(name = "http_status_code")
    private Integer httpStatusCode;

    @Column(name = "amount", precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "amount_usd", precision = 15, scale = 2)
    private BigDecimal amountUsd;

    @Column(name = "provider_transaction_id")
    private String providerTransactionId;

    @Column(name = "provider_status", length = 100)
    private String providerStatus;

    @Column(name = "latency_ms")
    private Integer latencyMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "normalization_method", nullable = false, length = 20)
    private NormalizationMethod normalizationMethod;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_data", nullable = false)
    private Map<String, Object> rawData;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "event_metadata")
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "normalized_at")
    private Instant normalizedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
