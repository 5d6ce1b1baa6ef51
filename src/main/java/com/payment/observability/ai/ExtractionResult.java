package com.payment.observability.ai;

import lombok.Builder;
import lombok.Value;

/**
 * Validated model output together with the model that produced it.
 */
@Value
@Builder
public class ExtractionResult<T> {

    T output;
    String modelUsed;
    /** True when the primary model failed and the secondary answered. */
    boolean fallbackUsed;
}
