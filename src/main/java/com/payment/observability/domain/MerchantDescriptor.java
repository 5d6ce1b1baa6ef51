package com.payment.observability.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Merchant data attached to a raw record by the data lake, outside the provider payload.
 */
@Value
@Builder
public class MerchantDescriptor {

    String id;
    String name;
    String country;
}
