package com.strategymonitor.alarm;

import com.strategymonitor.domain.enums.AlarmState;
import com.strategymonitor.domain.enums.AlarmTransition;
import com.strategymonitor.domain.enums.StrategyStatus;
import com.strategymonitor.domain.model.Strategy;
import com.strategymonitor.event.EventPublisherHelper;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-strategy edge detector for price targets.
 *
 * <p>Each strategy has one {@link AlarmState}. After every recompute the machine compares
 * the aggregate price with the target and emits at most one transition:
 * <ul>
 *   <li>NOT_ARMED and condition satisfied -> ARMED, emit REACHED</li>
 *   <li>ARMED and condition no longer satisfied (or price incomplete) -> NOT_ARMED, emit LEFT</li>
 *   <li>anything else -> no event</li>
 * </ul>
 * A price hovering past the target therefore produces one REACHED, not one per tick.
 *
 * <p>Strategies that are not ACTIVE never arm. Moving an ARMED strategy out of ACTIVE emits
 * LEFT; moving it back only re-arms on the next qualifying price.
 *
 * <p>Callers hold the strategy's lock, which serializes transitions for one strategy.
 * The state map itself is concurrent so different strategies never contend.
 */
@Service
public class AlarmStateMachine {

    private static final Logger log = LoggerFactory.getLogger(AlarmStateMachine.class);

    private final EventPublisherHelper eventPublisherHelper;

    private final Map<String, AlarmState> states = new ConcurrentHashMap<>();

    public AlarmStateMachine(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public void create(String strategyId) {
        states.put(strategyId, AlarmState.NOT_ARMED);
    }

    public void destroy(String strategyId) {
        states.remove(strategyId);
    }

    public AlarmState state(String strategyId) {
        return states.getOrDefault(strategyId, AlarmState.NOT_ARMED);
    }

    /** Runs the transition function against the strategy's current price. */
    public Optional<AlarmTransition> evaluate(Strategy strategy) {
        String strategyId = strategy.getId();
        AlarmState current = state(strategyId);

        if (strategy.getStatus() != StrategyStatus.ACTIVE) {
            states.put(strategyId, AlarmState.NOT_ARMED);
            return Optional.empty();
        }

        boolean worthy = isConditionMet(strategy);
        if (current == AlarmState.NOT_ARMED && worthy) {
            return transition(strategy, AlarmState.ARMED, AlarmTransition.REACHED);
        }
        if (current == AlarmState.ARMED && !worthy) {
            return transition(strategy, AlarmState.NOT_ARMED, AlarmTransition.LEFT);
        }
        return Optional.empty();
    }

    /**
     * Applies a status edit. Leaving ACTIVE while ARMED emits LEFT. Entering ACTIVE emits
     * nothing; the next recompute decides.
     */
    public Optional<AlarmTransition> onStatusChanged(Strategy strategy) {
        if (strategy.getStatus() == StrategyStatus.ACTIVE) {
            return Optional.empty();
        }
        if (state(strategy.getId()) == AlarmState.ARMED) {
            return transition(strategy, AlarmState.NOT_ARMED, AlarmTransition.LEFT);
        }
        states.put(strategy.getId(), AlarmState.NOT_ARMED);
        return Optional.empty();
    }

    /**
     * Applies a target or condition edit: the state is reset and re-evaluated against the
     * new target, so a still-qualifying price fires REACHED for the new target. An ARMED
     * alarm whose new target no longer qualifies emits LEFT.
     */
    public Optional<AlarmTransition> onTargetChanged(Strategy strategy) {
        boolean wasArmed = state(strategy.getId()) == AlarmState.ARMED;
        states.put(strategy.getId(), AlarmState.NOT_ARMED);

        Optional<AlarmTransition> result = evaluate(strategy);
        if (result.isEmpty() && wasArmed) {
            // edit-driven LEFT: the reset above hides the ARMED state from evaluate(), so the
            // previously armed alarm is closed here rather than by a price transition
            eventPublisherHelper.publishAlarm(this, strategy, AlarmTransition.LEFT, strategy.getAggregatePrice());
            log.info("Alarm left for strategy '{}' after target change", strategy.getName());
            return Optional.of(AlarmTransition.LEFT);
        }
        return result;
    }

    /**
     * Manual "continue" after an alarm: resets to NOT_ARMED without an event, so the next
     * qualifying recompute fires REACHED again.
     */
    public void rearm(String strategyId) {
        states.computeIfPresent(strategyId, (id, state) -> AlarmState.NOT_ARMED);
    }

    private boolean isConditionMet(Strategy strategy) {
        BigDecimal price = strategy.getAggregatePrice();
        BigDecimal target = strategy.getTargetPrice();
        if (price == null || target == null) {
            return false;
        }
        return strategy.getTargetCondition().isSatisfied(price, target);
    }

    private Optional<AlarmTransition> transition(Strategy strategy, AlarmState next, AlarmTransition transition) {
        states.put(strategy.getId(), next);
        BigDecimal price = strategy.getAggregatePrice();
        if (transition == AlarmTransition.REACHED) {
            log.info(
                    "Target reached for strategy '{}': price {} {} target {}",
                    strategy.getName(),
                    price.toPlainString(),
                    strategy.getTargetCondition(),
                    strategy.getTargetPrice().toPlainString());
        } else {
            log.info(
                    "Target left for strategy '{}': price {}",
                    strategy.getName(),
                    price != null ? price.toPlainString() : "incomplete");
        }
        eventPublisherHelper.publishAlarm(this, strategy, transition, price);
        return Optional.of(transition);
    }
}
