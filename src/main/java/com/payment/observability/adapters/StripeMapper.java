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
import java.util.Set;

/**
 * Stripe PaymentIntent, Charge and Refund objects. Amounts arrive in minor units.
 */
@Component
@Order(1)
public class StripeMapper implements ProviderMapper {

    private static final Set<String> STRIPE_OBJECTS = Set.of("payment_intent", "charge", "refund");
    private static final Set<String> ID_PREFIXES = Set.of("pi_", "ch_", "re_");

    private static final Map<String, PaymentStatus> STATUS_MAP = Map.of(
            "requires_payment_method", PaymentStatus.PENDING,
            "requires_confirmation", PaymentStatus.PENDING,
            "requires_action", PaymentStatus.PENDING,
            "processing", PaymentStatus.PENDING,
            "succeeded", PaymentStatus.APPROVED,
            "canceled", PaymentStatus.CANCELLED,
            "failed", PaymentStatus.FAILED
    );

    private static final Map<String, FailureReason> FAILURE_CODES = Map.ofEntries(
            Map.entry("card_declined", FailureReason.CARD_DECLINED),
            Map.entry("insufficient_funds", FailureReason.INSUFFICIENT_FUNDS),
            Map.entry("expired_card", FailureReason.EXPIRED_CARD),
            Map.entry("incorrect_cvc", FailureReason.INVALID_CARD),
            Map.entry("processing_error", FailureReason.PROVIDER_ERROR),
            Map.entry("card_velocity_exceeded", FailureReason.SECURITY_VIOLATION),
            Map.entry("fraudulent", FailureReason.FRAUD_SUSPECTED),
            Map.entry("authentication_required", FailureReason.SECURITY_VIOLATION),
            Map.entry("three_d_secure_failed", FailureReason.SECURITY_VIOLATION),
            Map.entry("lost_card", FailureReason.BLOCKED_CARD),
            Map.entry("stolen_card", FailureReason.BLOCKED_CARD),
            Map.entry("blocked_card", FailureReason.BLOCKED_CARD)
    );

    @Override
    public String providerName() {
        return "stripe";
    }

    @Override
    public double confidence() {
        return 0.85;
    }

    @Override
    public boolean canHandle(Map<String, Object> raw) {
        String objectType = PayloadValues.string(raw, "object");
        if (objectType != null && STRIPE_OBJECTS.contains(objectType)) {
            return true;
        }
        String id = PayloadValues.string(raw, "id");
        if (id == null || ID_PREFIXES.stream().noneMatch(id::startsWith)) {
            return false;
        }
        // an id prefix alone must not claim another provider's structurally distinct payload
        return !raw.containsKey("pspReference")
                && !raw.containsKey("collector_id")
                && !(raw.get("amount") instanceof Map);
    }

    @Override
    public PaymentStatus mapStatus(Map<String, Object> raw) {
        String status = PayloadValues.string(raw, "status");
        if (status == null) return PaymentStatus.PENDING;
        return STATUS_MAP.getOrDefault(status.toLowerCase(), PaymentStatus.PENDING);
    }

    @Override
    public Optional<FailureReason> mapFailureReason(Map<String, Object> raw) {
        Map<String, Object> lastError = PayloadValues.map(raw, "last_payment_error");
        String code = PayloadValues.string(lastError, "code");
        if (code == null) {
            code = PayloadValues.string(raw, "failure_code");
        }
        if (code == null) return Optional.empty();
        return Optional.of(FAILURE_CODES.getOrDefault(code.toLowerCase(), FailureReason.CARD_DECLINED));
    }

    @Override
    public ExtractedFields extractFields(Map<String, Object> raw) {
        BigDecimal amount = PayloadValues.fromMinorUnits(PayloadValues.decimal(raw, "amount"));
        String currency = PayloadValues.upper(PayloadValues.string(raw, "currency"));
        if (amount == null || currency == null) {
            amount = null;
            currency = null;
        }
        Map<String, Object> metadata = PayloadValues.map(raw, "metadata");
        String merchantId = PayloadValues.string(metadata, "merchant_id");
        if (merchantId == null) {
            merchantId = PayloadValues.string(metadata, "merchant");
        }
        return ExtractedFields.builder()
                .providerTransactionId(PayloadValues.string(raw, "id"))
                .merchantId(merchantId)
                .amount(amount)
                .currency(currency)
                .providerCreatedAt(PayloadValues.epochSeconds(raw, "created"))
                .build();
    }
}
