package com.strategymonitor.event;

import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a strategy's aggregate price changes value or definedness.
 * A null price means the strategy is price-incomplete.
 */
public class PriceChangedEvent extends ApplicationEvent {

    private final String strategyId;
    private final BigDecimal price;

    public PriceChangedEvent(Object source, String strategyId, BigDecimal price) {
        super(source);
        this.strategyId = strategyId;
        this.price = price;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public boolean isComplete() {
        return price != null;
    }
}
