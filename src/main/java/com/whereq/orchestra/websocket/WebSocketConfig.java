package com.whereq.orchestra.websocket;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

/**
 * WebSocket endpoint configuration. The handler adapter comes from the WebFlux configuration.
 */
@Configuration
public class WebSocketConfig {

    public static final String PATH = "/ws";

    @Bean
    public HandlerMapping notificationHandlerMapping(NotificationWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of(PATH, handler), -1);
    }
}
