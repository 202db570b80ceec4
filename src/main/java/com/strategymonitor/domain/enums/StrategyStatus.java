package com.strategymonitor.domain.enums;

/**
 * Lifecycle status of a monitored strategy.
 * Alarms are only evaluated while ACTIVE; DONE and CANCELLED strategies keep
 * being priced but never arm.
 */
public enum StrategyStatus {
    ACTIVE,
    DONE,
    CANCELLED
}
