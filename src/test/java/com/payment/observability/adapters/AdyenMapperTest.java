package com.payment.observability.adapters;

import com.payment.observability.core.ExtractedFields;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.PaymentStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdyenMapperTest {

    private final AdyenMapper mapper = new AdyenMapper();

    private static Map<String, Object> notification(String resultCode, String refusalReason) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("pspReference", "8535296650153317");
        raw.put("resultCode", resultCode);
        if (refusalReason != null) raw.put("refusalReason", refusalReason);
        raw.put("amount", Map.of("value", 12999, "currency", "eur"));
        raw.put("merchantAccount", "AcmeEU");
        raw.put("additionalData", Map.of("paymentMethod", "visa", "cardIssuingCountry", "de"));
        return raw;
    }

    @Test
    void recognizesPspReferenceOrPaymentMethod() {
        assertThat(mapper.canHandle(Map.of("pspReference", "123"))).isTrue();
        assertThat(mapper.canHandle(Map.of("additionalData", Map.of("paymentMethod", "mc")))).isTrue();
        assertThat(mapper.canHandle(Map.of("additionalData", Map.of("other", "x")))).isFalse();
    }

    @Test
    void mapsResultCodeCaseInsensitively() {
        assertThat(mapper.mapStatus(notification("Authorised", null))).isEqualTo(PaymentStatus.APPROVED);
        assertThat(mapper.mapStatus(notification("Refused", "Refused"))).isEqualTo(PaymentStatus.FAILED);
        assertThat(mapper.mapStatus(notification("Received", null))).isEqualTo(PaymentStatus.PENDING);
        assertThat(mapper.providerStatus(notification("Authorised", null))).isEqualTo("Authorised");
    }

    @Test
    void classifiesRefusalReasonOnlyForFailures() {
        assertThat(mapper.mapFailureReason(notification("Refused", "Not enough balance - insufficient funds")))
                .contains(FailureReason.INSUFFICIENT_FUNDS);
        assertThat(mapper.mapFailureReason(notification("Refused", "FRAUD")))
                .contains(FailureReason.FRAUD_SUSPECTED);
        assertThat(mapper.mapFailureReason(notification("Refused", "CVC Declined")))
                .contains(FailureReason.INVALID_CARD);
        assertThat(mapper.mapFailureReason(notification("Refused", "Do Not Honor")))
                .contains(FailureReason.CARD_DECLINED);
        assertThat(mapper.mapFailureReason(notification("Authorised", "FRAUD"))).isEmpty();
    }

    @Test
    void extractsAmountObjectAndIssuingCountry() {
        ExtractedFields fields = mapper.extractFields(notification("Authorised", null));

        assertThat(fields.getAmount()).isEqualByComparingTo(new BigDecimal("129.99"));
        assertThat(fields.getCurrency()).isEqualTo("EUR");
        assertThat(fields.getMerchantId()).isEqualTo("AcmeEU");
        assertThat(fields.getCountryCode()).isEqualTo("DE");
        assertThat(fields.getProviderTransactionId()).isEqualTo("8535296650153317");
    }
}
