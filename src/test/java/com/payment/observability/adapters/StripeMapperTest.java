package com.payment.observability.adapters;

import com.payment.observability.core.ExtractedFields;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.PaymentStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StripeMapperTest {

    private final StripeMapper mapper = new StripeMapper();

    private static Map<String, Object> paymentIntent(String status) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "pi_3MtwBwLkdIwHu7ix28a3tqPa");
        raw.put("object", "payment_intent");
        raw.put("amount", 5000);
        raw.put("currency", "usd");
        raw.put("status", status);
        raw.put("created", 1680800504L);
        raw.put("metadata", Map.of("merchant_id", "shop_42"));
        return raw;
    }

    @Test
    void recognizesStripeObjectTypes() {
        assertThat(mapper.canHandle(Map.of("object", "charge", "id", "ch_1"))).isTrue();
        assertThat(mapper.canHandle(Map.of("object", "refund"))).isTrue();
        assertThat(mapper.canHandle(Map.of("id", "pi_123", "status", "succeeded"))).isTrue();
    }

    @Test
    void idPrefixDoesNotClaimOtherProvidersPayloads() {
        assertThat(mapper.canHandle(Map.of("id", "pi_1", "pspReference", "8535"))).isFalse();
        assertThat(mapper.canHandle(Map.of("id", "ch_1", "amount", Map.of("value", 100, "currency", "EUR")))).isFalse();
        assertThat(mapper.canHandle(Map.of("id", "txn_1", "status", "succeeded"))).isFalse();
    }

    @Test
    void mapsStatusesAndDefaultsUnknownToPending() {
        assertThat(mapper.mapStatus(paymentIntent("succeeded"))).isEqualTo(PaymentStatus.APPROVED);
        assertThat(mapper.mapStatus(paymentIntent("requires_action"))).isEqualTo(PaymentStatus.PENDING);
        assertThat(mapper.mapStatus(paymentIntent("canceled"))).isEqualTo(PaymentStatus.CANCELLED);
        assertThat(mapper.mapStatus(paymentIntent("failed"))).isEqualTo(PaymentStatus.FAILED);
        assertThat(mapper.mapStatus(paymentIntent("something_new"))).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    void mapsLastPaymentErrorCode() {
        Map<String, Object> raw = paymentIntent("requires_payment_method");
        raw.put("last_payment_error", Map.of("code", "insufficient_funds"));
        assertThat(mapper.mapFailureReason(raw)).contains(FailureReason.INSUFFICIENT_FUNDS);

        raw.put("last_payment_error", Map.of("code", "some_new_code"));
        assertThat(mapper.mapFailureReason(raw)).contains(FailureReason.CARD_DECLINED);

        assertThat(mapper.mapFailureReason(paymentIntent("succeeded"))).isEmpty();
    }

    @Test
    void convertsMinorUnitsAndUppercasesCurrency() {
        ExtractedFields fields = mapper.extractFields(paymentIntent("succeeded"));

        assertThat(fields.getAmount()).isEqualByComparingTo(new BigDecimal("50.00"));
        assertThat(fields.getCurrency()).isEqualTo("USD");
        assertThat(fields.getProviderTransactionId()).isEqualTo("pi_3MtwBwLkdIwHu7ix28a3tqPa");
        assertThat(fields.getMerchantId()).isEqualTo("shop_42");
        assertThat(fields.getProviderCreatedAt()).isEqualTo(Instant.ofEpochSecond(1680800504L));
    }

    @Test
    void dropsAmountWhenCurrencyMissing() {
        Map<String, Object> raw = paymentIntent("succeeded");
        raw.remove("currency");

        ExtractedFields fields = mapper.extractFields(raw);

        assertThat(fields.getAmount()).isNull();
        assertThat(fields.getCurrency()).isNull();
    }
}
