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
 * Adyen payment responses and notifications: {@code resultCode}, {@code refusalReason} and an
 * {@code amount} object with minor-unit value.
 */
@Component
@Order(2)
public class AdyenMapper implements ProviderMapper {

    private static final Map<String, PaymentStatus> STATUS_MAP = Map.of(
            "authorised", PaymentStatus.APPROVED,
            "refused", PaymentStatus.FAILED,
            "error", PaymentStatus.FAILED,
            "cancelled", PaymentStatus.CANCELLED,
            "pending", PaymentStatus.PENDING,
            "received", PaymentStatus.PENDING
    );

    @Override
    public String providerName() {
        return "adyen";
    }

    @Override
    public double confidence() {
        return 0.80;
    }

    @Override
    public boolean canHandle(Map<String, Object> raw) {
        if (raw.containsKey("pspReference")) return true;
        Map<String, Object> additionalData = PayloadValues.map(raw, "additionalData");
        return additionalData != null && additionalData.containsKey("paymentMethod");
    }

    @Override
    public PaymentStatus mapStatus(Map<String, Object> raw) {
        String resultCode = PayloadValues.string(raw, "resultCode");
        if (resultCode == null) return PaymentStatus.PENDING;
        return STATUS_MAP.getOrDefault(resultCode.toLowerCase(), PaymentStatus.PENDING);
    }

    @Override
    public Optional<FailureReason> mapFailureReason(Map<String, Object> raw) {
        if (mapStatus(raw) != PaymentStatus.FAILED) return Optional.empty();
        String refusal = PayloadValues.string(raw, "refusalReason");
        if (refusal == null) return Optional.of(FailureReason.CARD_DECLINED);
        String reason = refusal.toLowerCase();
        if (reason.contains("fraud") || reason.contains("security")) return Optional.of(FailureReason.FRAUD_SUSPECTED);
        if (reason.contains("insufficient")) return Optional.of(FailureReason.INSUFFICIENT_FUNDS);
        if (reason.contains("expired")) return Optional.of(FailureReason.EXPIRED_CARD);
        if (reason.contains("cvc") || reason.contains("cvv")) return Optional.of(FailureReason.INVALID_CARD);
        if (reason.contains("3d")) return Optional.of(FailureReason.SECURITY_VIOLATION);
        return Optional.of(FailureReason.CARD_DECLINED);
    }

    @Override
    public String providerStatus(Map<String, Object> raw) {
        return PayloadValues.string(raw, "resultCode");
    }

    @Override
    public ExtractedFields extractFields(Map<String, Object> raw) {
        Map<String, Object> amountObject = PayloadValues.map(raw, "amount");
        BigDecimal amount = PayloadValues.fromMinorUnits(PayloadValues.decimal(amountObject, "value"));
        String currency = PayloadValues.upper(PayloadValues.string(amountObject, "currency"));
        if (amount == null || currency == null) {
            amount = null;
            currency = null;
        }
        String merchantId = PayloadValues.string(raw, "merchantReference");
        if (merchantId == null) {
            merchantId = PayloadValues.string(raw, "merchantAccount");
        }
        Map<String, Object> additionalData = PayloadValues.map(raw, "additionalData");
        return ExtractedFields.builder()
                .providerTransactionId(PayloadValues.string(raw, "pspReference"))
                .merchantId(merchantId)
                .amount(amount)
                .currency(currency)
                .countryCode(PayloadValues.upper(PayloadValues.string(additionalData, "cardIssuingCountry")))
                .build();
    }
}
