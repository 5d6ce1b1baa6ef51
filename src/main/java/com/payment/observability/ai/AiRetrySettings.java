package com.payment.observability.ai;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class AiRetrySettings {

    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration initialBackoff = Duration.ofSeconds(2);
    @Builder.Default
    double backoffMultiplier = 2.0;
    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(10);
    /** Per-attempt timeout, reported on {@code NormalizationTimeoutException}. */
    @Builder.Default
    int timeoutSeconds = 10;
}
