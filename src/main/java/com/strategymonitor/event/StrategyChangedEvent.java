package com.strategymonitor.event;

import com.strategymonitor.domain.enums.ChangeType;
import com.strategymonitor.domain.model.StrategySnapshot;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a structural edit to a strategy (legs, target, status, name).
 * Price ticks do not publish this event.
 *
 * <p>{@code snapshot} is the state right after the edit, or null for DELETED.
 */
public class StrategyChangedEvent extends ApplicationEvent {

    private final String strategyId;
    private final ChangeType changeType;
    private final StrategySnapshot snapshot;

    public StrategyChangedEvent(Object source, String strategyId, ChangeType changeType, StrategySnapshot snapshot) {
        super(source);
        this.strategyId = strategyId;
        this.changeType = changeType;
        this.snapshot = snapshot;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public StrategySnapshot getSnapshot() {
        return snapshot;
    }
}
