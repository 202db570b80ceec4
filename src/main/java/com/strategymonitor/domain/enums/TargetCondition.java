package com.strategymonitor.domain.enums;

import java.math.BigDecimal;

/**
 * Which side of the target price arms the alarm. Both comparisons are inclusive.
 */
public enum TargetCondition {

    /** Alarm when price <= target. */
    BELOW,

    /** Alarm when price >= target. */
    ABOVE;

    public boolean isSatisfied(BigDecimal price, BigDecimal target) {
        int cmp = price.compareTo(target);
        return this == BELOW ? cmp <= 0 : cmp >= 0;
    }
}
