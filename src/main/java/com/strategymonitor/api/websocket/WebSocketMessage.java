package com.strategymonitor.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every STOMP message: {@code { type, data }}. Clients subscribe once to
 * {@code /topic/updates} and dispatch on {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    /** ALARM, PRICE, SUBSCRIPTION or STRATEGY. */
    private String type;

    private Object data;

    public static WebSocketMessage of(String type, Object data) {
        return new WebSocketMessage(type, data);
    }
}
