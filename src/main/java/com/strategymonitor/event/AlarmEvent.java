package com.strategymonitor.event;

import com.strategymonitor.domain.enums.AlarmTransition;
import com.strategymonitor.domain.enums.TargetCondition;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@code AlarmStateMachine} once per threshold crossing.
 *
 * <p>Consumed by:
 * <ul>
 *   <li>{@code UpdatesHandler} -- pushes an ALARM message to {@code /topic/updates}</li>
 *   <li>{@code MonitorMetrics} -- counts reached/left transitions</li>
 * </ul>
 *
 * <p>{@code price} is null for a LEFT caused by the price becoming incomplete or by
 * the strategy leaving its active phase without a price.
 */
public class AlarmEvent extends ApplicationEvent {

    private final String strategyId;
    private final String strategyName;
    private final AlarmTransition transition;
    private final BigDecimal price;
    private final BigDecimal targetPrice;
    private final TargetCondition targetCondition;
    private final Instant occurredAt;

    public AlarmEvent(
            Object source,
            String strategyId,
            String strategyName,
            AlarmTransition transition,
            BigDecimal price,
            BigDecimal targetPrice,
            TargetCondition targetCondition) {
        super(source);
        this.strategyId = strategyId;
        this.strategyName = strategyName;
        this.transition = transition;
        this.price = price;
        this.targetPrice = targetPrice;
        this.targetCondition = targetCondition;
        this.occurredAt = Instant.now();
    }

    public String getStrategyId() {
        return strategyId;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public AlarmTransition getTransition() {
        return transition;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getTargetPrice() {
        return targetPrice;
    }

    public TargetCondition getTargetCondition() {
        return targetCondition;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
