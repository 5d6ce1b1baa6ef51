package com.payment.observability.alert.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Event volume and approval rate for one provider, merchant or country within a window.
 */
@Value
@Builder
public class DimensionStats {

    String name;
    long total;
    long approved;

    public long getFailed() {
        return total - approved;
    }

    /** Percentage in [0, 100]; 0 for an empty dimension. */
    public double getSuccessRate() {
        return total == 0 ? 0.0 : approved * 100.0 / total;
    }
}
