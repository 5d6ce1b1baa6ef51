package com.payment.observability.adapters;

import com.payment.observability.core.ExtractedFields;
import com.payment.observability.core.PayloadValues;
import com.payment.observability.core.ProviderMapper;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.PaymentStatus;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Mercado Pago payments. {@code transaction_amount} is already in major units.
 */
@Component
@Order(3)
public class MercadoPagoMapper implements ProviderMapper {

    private static final Map<String, PaymentStatus> STATUS_MAP = Map.of(
            "approved", PaymentStatus.APPROVED,
            "rejected", PaymentStatus.FAILED,
            "pending", PaymentStatus.PENDING,
            "in_process", PaymentStatus.PENDING,
            "cancelled", PaymentStatus.CANCELLED,
            "refunded", PaymentStatus.REFUNDED
    );

    private static final Map<String, FailureReason> STATUS_DETAILS = Map.of(
            "cc_rejected_insufficient_amount", FailureReason.INSUFFICIENT_FUNDS,
            "cc_rejected_bad_filled_security_code", FailureReason.INVALID_CARD,
            "cc_rejected_blacklist", FailureReason.BLOCKED_CARD,
            "cc_rejected_high_risk", FailureReason.FRAUD_SUSPECTED,
            "cc_rejected_call_for_authorize", FailureReason.SECURITY_VIOLATION
    );

    @Override
    public String providerName() {
        return "mercadopago";
    }

    @Override
    public double confidence() {
        return 0.80;
    }

    @Override
    public boolean canHandle(Map<String, Object> raw) {
        return raw.containsKey("collector_id") || raw.containsKey("payment_method_id");
    }

    @Override
    public PaymentStatus mapStatus(Map<String, Object> raw) {
        String status = PayloadValues.string(raw, "status");
        if (status == null) return PaymentStatus.PENDING;
        return STATUS_MAP.getOrDefault(status.toLowerCase(), PaymentStatus.PENDING);
    }

    @Override
    public Optional<FailureReason> mapFailureReason(Map<String, Object> raw) {
        if (mapStatus(raw) != PaymentStatus.FAILED) return Optional.empty();
        String detail = PayloadValues.string(raw, "status_detail");
        if (detail == null) return Optional.of(FailureReason.CARD_DECLINED);
        return Optional.of(STATUS_DETAILS.getOrDefault(detail.toLowerCase(), FailureReason.CARD_DECLINED));
    }

    @Override
    public ExtractedFields extractFields(Map<String, Object> raw) {
        BigDecimal amount = PayloadValues.toMoney(PayloadValues.decimal(raw, "transaction_amount"));
        String currency = PayloadValues.upper(PayloadValues.string(raw, "currency_id"));
        if (amount == null || currency == null) {
            amount = null;
            currency = null;
        }
        return ExtractedFields.builder()
                .providerTransactionId(PayloadValues.string(raw, "id"))
                .merchantId(PayloadValues.string(raw, "collector_id"))
                .amount(amount)
                .currency(currency)
                .providerCreatedAt(PayloadValues.isoTimestamp(raw, "date_created"))
                .providerUpdatedAt(PayloadValues.isoTimestamp(raw, "date_last_updated"))
                .build();
    }
}
