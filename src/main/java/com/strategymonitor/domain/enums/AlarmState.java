package com.strategymonitor.domain.enums;

/** Edge-detection state of a strategy's target alarm. */
public enum AlarmState {
    NOT_ARMED,
    ARMED
}
