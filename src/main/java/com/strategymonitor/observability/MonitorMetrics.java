package com.strategymonitor.observability;

import com.strategymonitor.core.store.StrategyStore;
import com.strategymonitor.domain.enums.AlarmTransition;
import com.strategymonitor.domain.enums.SubscriptionStatus;
import com.strategymonitor.event.AlarmEvent;
import com.strategymonitor.event.SubscriptionStatusEvent;
import com.strategymonitor.marketdata.SubscriptionMultiplexer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the monitor, exposed through the actuator:
 * <ul>
 *   <li><b>quotes.routed</b> / <b>quotes.dropped</b> (function counters): read from the multiplexer</li>
 *   <li><b>alarms.reached</b> / <b>alarms.left</b> (counters): one per alarm transition</li>
 *   <li><b>subscriptions.failed</b> (counter): failed subscription callbacks</li>
 *   <li><b>subscriptions.active</b> (gauge): tickers with an issued subscription</li>
 *   <li><b>strategies.count</b> (gauge): strategies in memory</li>
 * </ul>
 */
@Service
public class MonitorMetrics {

    private final Counter alarmsReachedCounter;
    private final Counter alarmsLeftCounter;
    private final Counter subscriptionFailuresCounter;

    public MonitorMetrics(
            MeterRegistry meterRegistry,
            SubscriptionMultiplexer subscriptionMultiplexer,
            StrategyStore strategyStore) {
        this.alarmsReachedCounter = Counter.builder("alarms.reached")
                .description("Target reached transitions")
                .register(meterRegistry);

        this.alarmsLeftCounter = Counter.builder("alarms.left")
                .description("Target left transitions")
                .register(meterRegistry);

        this.subscriptionFailuresCounter = Counter.builder("subscriptions.failed")
                .description("Subscription failures reported by the market data session")
                .register(meterRegistry);

        FunctionCounter.builder("quotes.routed", subscriptionMultiplexer, SubscriptionMultiplexer::routedQuoteCount)
                .description("Quotes delivered to legs")
                .register(meterRegistry);

        FunctionCounter.builder("quotes.dropped", subscriptionMultiplexer, SubscriptionMultiplexer::droppedQuoteCount)
                .description("Quotes for tickers with no interested leg")
                .register(meterRegistry);

        meterRegistry.gauge(
                "subscriptions.active", subscriptionMultiplexer, SubscriptionMultiplexer::activeSubscriptionCount);

        meterRegistry.gauge("strategies.count", strategyStore, StrategyStore::size);
    }

    @EventListener
    @Order(20)
    public void onAlarm(AlarmEvent alarmEvent) {
        if (alarmEvent.getTransition() == AlarmTransition.REACHED) {
            alarmsReachedCounter.increment();
        } else {
            alarmsLeftCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onSubscriptionStatus(SubscriptionStatusEvent subscriptionStatusEvent) {
        if (subscriptionStatusEvent.getStatus() == SubscriptionStatus.FAILED) {
            subscriptionFailuresCounter.increment();
        }
    }
}
