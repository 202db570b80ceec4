package com.strategymonitor.core.processor;

import java.math.BigDecimal;

/**
 * Result of a strategy recompute. Either price may be null ("incomplete").
 *
 * @param previous aggregate price before the recompute
 * @param current  aggregate price after the recompute
 */
public record PriceUpdate(BigDecimal previous, BigDecimal current) {

    /** True when the value or its definedness changed. Scale differences do not count. */
    public boolean changed() {
        if (previous == null || current == null) {
            return previous != current;
        }
        return previous.compareTo(current) != 0;
    }
}
