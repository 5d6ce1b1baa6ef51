package com.payment.observability.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payment.observability.domain.ErrorSource;
import com.payment.observability.domain.FailureReason;
import com.payment.observability.domain.PaymentStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * JSON object the model must return for a payment event. Everything except provider and
 * status category may be null.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiNormalizationOutput {

    @JsonProperty("merchant_name")
    @Size(max = 255)
    String merchantName;

    @JsonProperty("provider")
    @NotBlank
    String provider;

    @JsonProperty("provider_transaction_id")
    String providerTransactionId;

    @JsonProperty("provider_status")
    String providerStatus;

    @JsonProperty("country")
    @Pattern(regexp = "^[A-Za-z]{2}$")
    String country;

    @JsonProperty("status_category")
    @NotNull
    PaymentStatus statusCategory;

    @JsonProperty("failure_reason")
    FailureReason failureReason;

    @JsonProperty("error_source")
    ErrorSource errorSource;

    @JsonProperty("http_status_code")
    @Min(100)
    @Max(599)
    Integer httpStatusCode;

    @JsonProperty("amount")
    @DecimalMin(value = "0", inclusive = false)
    BigDecimal amount;

    @JsonProperty("currency")
    @Pattern(regexp = "^[A-Za-z]{3}$")
    String currency;

    @JsonProperty("latency_ms")
    @PositiveOrZero
    Integer latencyMs;
}
