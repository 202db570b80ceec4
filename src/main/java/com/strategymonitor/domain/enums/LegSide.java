package com.strategymonitor.domain.enums;

/**
 * Direction of a leg inside a strategy. LONG legs add their price to the
 * strategy price, SHORT legs subtract it.
 */
public enum LegSide {
    LONG(1),
    SHORT(-1);

    private final int multiplier;

    LegSide(int multiplier) {
        this.multiplier = multiplier;
    }

    public int getMultiplier() {
        return multiplier;
    }

    public LegSide opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
