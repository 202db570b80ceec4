package com.strategymonitor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Configures the STOMP WebSocket message broker.
 *
 * <p>Registers the {@code /ws} endpoint and a simple broker on {@code /topic}. Alarm,
 * price and subscription-status updates are pushed to {@code /topic/updates} by
 * {@link com.strategymonitor.api.websocket.UpdatesHandler}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final MonitorProperties monitorProperties;

    public WebSocketConfig(MonitorProperties monitorProperties) {
        this.monitorProperties = monitorProperties;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(monitorProperties.getCors().getAllowedOrigin());
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }
}
