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

class MercadoPagoMapperTest {

    private final MercadoPagoMapper mapper = new MercadoPagoMapper();

    private static Map<String, Object> payment(String status, String detail) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", 20359978);
        raw.put("status", status);
        raw.put("status_detail", detail);
        raw.put("transaction_amount", 150.5);
        raw.put("currency_id", "brl");
        raw.put("collector_id", 448876418);
        raw.put("payment_method_id", "visa");
        raw.put("date_created", "2024-03-01T10:15:30.000-04:00");
        return raw;
    }

    @Test
    void recognizesCollectorOrPaymentMethod() {
        assertThat(mapper.canHandle(Map.of("collector_id", 1))).isTrue();
        assertThat(mapper.canHandle(Map.of("payment_method_id", "pix"))).isTrue();
        assertThat(mapper.canHandle(Map.of("id", 1))).isFalse();
    }

    @Test
    void mapsStatusAndDetail() {
        assertThat(mapper.mapStatus(payment("approved", "accredited"))).isEqualTo(PaymentStatus.APPROVED);
        assertThat(mapper.mapStatus(payment("in_process", null))).isEqualTo(PaymentStatus.PENDING);
        assertThat(mapper.mapStatus(payment("refunded", null))).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(mapper.mapFailureReason(payment("rejected", "cc_rejected_high_risk")))
                .contains(FailureReason.FRAUD_SUSPECTED);
        assertThat(mapper.mapFailureReason(payment("rejected", "cc_rejected_other_reason")))
                .contains(FailureReason.CARD_DECLINED);
        assertThat(mapper.mapFailureReason(payment("approved", "accredited"))).isEmpty();
    }

    @Test
    void keepsMajorUnitAmounts() {
        ExtractedFields fields = mapper.extractFields(payment("approved", "accredited"));

        assertThat(fields.getAmount()).isEqualByComparingTo(new BigDecimal("150.50"));
        assertThat(fields.getCurrency()).isEqualTo("BRL");
        assertThat(fields.getMerchantId()).isEqualTo("448876418");
        assertThat(fields.getProviderTransactionId()).isEqualTo("20359978");
        assertThat(fields.getProviderCreatedAt()).isEqualTo(Instant.parse("2024-03-01T14:15:30Z"));
    }
}
