package com.strategymonitor.api.websocket;

import com.strategymonitor.api.dto.response.StrategyResponse;
import com.strategymonitor.event.AlarmEvent;
import com.strategymonitor.event.PriceChangedEvent;
import com.strategymonitor.event.StrategyChangedEvent;
import com.strategymonitor.event.SubscriptionStatusEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Pushes engine events to {@code /topic/updates}:
 * <ul>
 *   <li>"ALARM" -- target reached / left</li>
 *   <li>"PRICE" -- aggregate price changed (null price = incomplete)</li>
 *   <li>"SUBSCRIPTION" -- subscription started / failed, session terminated</li>
 *   <li>"STRATEGY" -- strategy created / updated / deleted</li>
 * </ul>
 *
 * <p>All handlers run on the eventExecutor so a slow broker never stalls quote processing.
 */
@Component
public class UpdatesHandler {

    private static final Logger log = LoggerFactory.getLogger(UpdatesHandler.class);

    static final String DESTINATION = "/topic/updates";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public UpdatesHandler(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Async("eventExecutor")
    @EventListener
    public void onAlarm(AlarmEvent alarmEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("strategyId", alarmEvent.getStrategyId());
        payload.put("strategyName", alarmEvent.getStrategyName());
        payload.put("transition", alarmEvent.getTransition().name());
        payload.put("price", alarmEvent.getPrice());
        payload.put("targetPrice", alarmEvent.getTargetPrice());
        payload.put("targetCondition", alarmEvent.getTargetCondition().name());
        payload.put("occurredAt", alarmEvent.getOccurredAt().toString());

        sendUpdate("ALARM", payload);
    }

    @Async("eventExecutor")
    @EventListener
    public void onPriceChanged(PriceChangedEvent priceChangedEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("strategyId", priceChangedEvent.getStrategyId());
        payload.put("price", priceChangedEvent.getPrice());
        payload.put("complete", priceChangedEvent.isComplete());

        sendUpdate("PRICE", payload);
    }

    @Async("eventExecutor")
    @EventListener
    public void onSubscriptionStatus(SubscriptionStatusEvent subscriptionStatusEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", subscriptionStatusEvent.getStatus().name());
        payload.put("ticker", subscriptionStatusEvent.getTicker());
        payload.put("reason", subscriptionStatusEvent.getReason());

        sendUpdate("SUBSCRIPTION", payload);
    }

    @Async("eventExecutor")
    @EventListener
    public void onStrategyChanged(StrategyChangedEvent strategyChangedEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("changeType", strategyChangedEvent.getChangeType().name());
        payload.put("strategyId", strategyChangedEvent.getStrategyId());
        payload.put(
                "strategy",
                strategyChangedEvent.getSnapshot() != null
                        ? StrategyResponse.from(strategyChangedEvent.getSnapshot())
                        : null);

        sendUpdate("STRATEGY", payload);
    }

    private void sendUpdate(String type, Object data) {
        try {
            simpMessagingTemplate.convertAndSend(DESTINATION, WebSocketMessage.of(type, data));
        } catch (Exception e) {
            log.error("Failed to send {} update via WebSocket: {}", type, e.getMessage());
        }
    }
}
