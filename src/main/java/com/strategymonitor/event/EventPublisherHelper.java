package com.strategymonitor.event;

import com.strategymonitor.domain.enums.AlarmTransition;
import com.strategymonitor.domain.enums.ChangeType;
import com.strategymonitor.domain.enums.SubscriptionStatus;
import com.strategymonitor.domain.model.Strategy;
import com.strategymonitor.domain.model.StrategySnapshot;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Delivery mode is decided by the listener: plain {@code @EventListener} runs on the
 * publishing thread, {@code @Async("eventExecutor") @EventListener} on the event pool.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Alarm ----

    public void publishAlarm(Object source, Strategy strategy, AlarmTransition transition, BigDecimal price) {
        applicationEventPublisher.publishEvent(new AlarmEvent(
                source,
                strategy.getId(),
                strategy.getName(),
                transition,
                price,
                strategy.getTargetPrice(),
                strategy.getTargetCondition()));
    }

    // ---- Price ----

    public void publishPriceChanged(Object source, String strategyId, BigDecimal price) {
        applicationEventPublisher.publishEvent(new PriceChangedEvent(source, strategyId, price));
    }

    // ---- Subscription ----

    public void publishSubscriptionStarted(Object source, String ticker) {
        applicationEventPublisher.publishEvent(
                new SubscriptionStatusEvent(source, SubscriptionStatus.STARTED, ticker, null));
    }

    public void publishSubscriptionFailed(Object source, String ticker, String reason) {
        applicationEventPublisher.publishEvent(
                new SubscriptionStatusEvent(source, SubscriptionStatus.FAILED, ticker, reason));
    }

    public void publishSessionTerminated(Object source) {
        applicationEventPublisher.publishEvent(
                new SubscriptionStatusEvent(source, SubscriptionStatus.SESSION_TERMINATED, null, null));
    }

    // ---- Strategy ----

    public void publishStrategyChanged(Object source, Strategy strategy, ChangeType changeType) {
        applicationEventPublisher.publishEvent(
                new StrategyChangedEvent(source, strategy.getId(), changeType, StrategySnapshot.of(strategy)));
    }

    public void publishStrategyDeleted(Object source, String strategyId) {
        applicationEventPublisher.publishEvent(new StrategyChangedEvent(source, strategyId, ChangeType.DELETED, null));
    }
}
