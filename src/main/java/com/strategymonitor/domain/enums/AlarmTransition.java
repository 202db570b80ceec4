package com.strategymonitor.domain.enums;

/**
 * Alarm transitions reported to listeners. Exactly one transition is emitted per
 * threshold crossing.
 */
public enum AlarmTransition {

    /** The target condition became satisfied. */
    REACHED,

    /** The target condition stopped being satisfied (or the price became incomplete). */
    LEFT
}
