package com.strategymonitor.event;

import com.strategymonitor.domain.enums.SubscriptionStatus;
import org.springframework.context.ApplicationEvent;

/**
 * Status callback from the market-data session, surfaced to observers. Ticker is
 * null for {@link SubscriptionStatus#SESSION_TERMINATED}; reason is only set for failures.
 */
public class SubscriptionStatusEvent extends ApplicationEvent {

    private final SubscriptionStatus status;
    private final String ticker;
    private final String reason;

    public SubscriptionStatusEvent(Object source, SubscriptionStatus status, String ticker, String reason) {
        super(source);
        this.status = status;
        this.ticker = ticker;
        this.reason = reason;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public String getTicker() {
        return ticker;
    }

    public String getReason() {
        return reason;
    }
}
