package com.whereq.orchestra.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.notification.NotificationBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * WebSocket transport for the notification bus, served on {@code /ws}.
 *
 * <p>Clients send {@code {"type":"subscribe","channel":"job:<id>"}} to start receiving events for
 * a channel and {@code unsubscribe} to stop; {@code ping} is answered with {@code pong}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationWebSocketHandler implements WebSocketHandler {

    private final NotificationBus notificationBus;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        ClientSession client = new ClientSession(UUID.randomUUID().toString(), notificationBus, objectMapper);
        log.info("WebSocket client {} connected from {}", client.clientId(), session.getHandshakeInfo().getRemoteAddress());
        client.open();

        Mono<Void> input = session.receive()
            .map(WebSocketMessage::getPayloadAsText)
            .doOnNext(client::receive)
            .then();

        Mono<Void> output = session.send(client.outbound().map(session::textMessage));

        return Mono.zip(input, output)
            .then()
            .doOnError(e -> log.warn("WebSocket client {} failed: {}", client.clientId(), e.getMessage()))
            .doFinally(signal -> client.close());
    }
}
