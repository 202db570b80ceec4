package com.strategymonitor.domain.enums;

/** Status notifications coming back from the market-data session. */
public enum SubscriptionStatus {
    STARTED,
    FAILED,
    SESSION_TERMINATED
}
