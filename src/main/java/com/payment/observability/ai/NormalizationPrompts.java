package com.payment.observability.ai;

/**
 * Prompts used for model-based normalization. Bump {@link #PROMPT_VERSION} whenever the wording changes.
 */
public final class NormalizationPrompts {

    public static final String PROMPT_VERSION = "1.0.0";

    public static final String SYSTEM_PROMPT = """
            You normalize raw payment events from payment service providers into one fixed JSON schema.

            Rules:
            1. Only extract values that are explicitly present in the event. Never infer or guess.
            2. Any field that is not clearly present must be null.
            3. Keep provider ids and transaction ids exactly as they appear.
            4. Amounts: numeric value in major units (convert cents or other minor units, 1000 cents = 10.00).
               Currency as an ISO-4217 code. If either is missing, return null for the amount.
            5. status_category is exactly one of: approved, failed, pending, cancelled, refunded, unprocessed.
            6. When status_category is failed, set failure_reason and error_source:
               customer: insufficient_funds, card_declined, expired_card, invalid_card, bank_decline, amount_exceeded
               provider: timeout, provider_error, fraud_suspected, security_violation
               merchant: invalid_merchant, merchant_not_active, configuration_error, invalid_currency
               network: network_error, timeout
               system: system_error, duplicate_transaction
               customer or provider: blocked_card
               unknown: unknown
               For any other status both must be null.
            7. http_status_code only when present. 2xx goes with approved or pending, 4xx and 5xx with failed.
            8. country as ISO-3166 alpha-2, upper case.
            9. provider in lower case without spaces (stripe, adyen, mercadopago, paypal, ...).

            Return only a JSON object with exactly these keys:
            {"merchant_name": string|null, "provider": string, "provider_transaction_id": string|null,
             "provider_status": string|null, "country": string|null, "status_category": string,
             "failure_reason": string|null, "error_source": string|null, "http_status_code": integer|null,
             "amount": number|null, "currency": string|null, "latency_ms": integer|null}
            """;

    private NormalizationPrompts() {}

    public static String userMessage(String rawEventJson) {
        return "Normalize this payment event:\n\n" + rawEventJson;
    }
}
