package com.whereq.orchestra.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.orchestra.notification.NotificationBus;
import com.whereq.orchestra.notification.NotificationEnvelope;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server side of one client connection: its bus subscriptions and its outbound frames.
 *
 * <p>Bus events arrive on publisher threads while replies are produced on the connection's
 * inbound thread, so every frame goes through one serialized sink. The sink buffer is bounded;
 * frames for a client that stops reading are dropped.
 */
@Slf4j
class ClientSession {

    static final int DEFAULT_BUFFER_SIZE = 256;

    private final String clientId;
    private final NotificationBus notificationBus;
    private final ObjectMapper objectMapper;

    private final Sinks.Many<String> outbound;
    private final Map<String, Disposable> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong dropped = new AtomicLong();

    ClientSession(String clientId, NotificationBus notificationBus, ObjectMapper objectMapper) {
        this(clientId, notificationBus, objectMapper, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize frames held for a client that is not reading; further frames are dropped
     */
    ClientSession(String clientId, NotificationBus notificationBus, ObjectMapper objectMapper, int bufferSize) {
        this.clientId = clientId;
        this.notificationBus = notificationBus;
        this.objectMapper = objectMapper;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    String clientId() {
        return clientId;
    }

    /**
     * Frames to write to the client, starting with the connected greeting
     */
    Flux<String> outbound() {
        return outbound.asFlux();
    }

    void open() {
        send(reply("connected").put("clientId", clientId));
    }

    /**
     * Handle one text frame from the client
     */
    void receive(String text) {
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            send(error("Invalid message format"));
            return;
        }
        if (message == null || !message.isObject()) {
            send(error("Invalid message format"));
            return;
        }

        String type = message.path("type").asText("");
        String channel = message.path("channel").asText(null);
        switch (type) {
            case "subscribe" -> {
                if (channel == null || channel.isBlank()) {
                    send(error("Channel is required"));
                } else {
                    subscribe(channel);
                }
            }
            case "unsubscribe" -> {
                if (channel == null || channel.isBlank()) {
                    send(error("Channel is required"));
                } else {
                    unsubscribe(channel);
                }
            }
            case "ping" -> send(reply("pong"));
            default -> send(error("Unknown message type: " + type));
        }
    }

    private void subscribe(String channel) {
        subscriptions.computeIfAbsent(channel, key -> notificationBus.subscribe(key, this::deliver));
        log.debug("Client {} subscribed to {}", clientId, channel);
        send(reply("subscribed").put("channel", channel));
    }

    private void unsubscribe(String channel) {
        Disposable subscription = subscriptions.remove(channel);
        if (subscription != null) {
            subscription.dispose();
        }
        send(reply("unsubscribed").put("channel", channel));
    }

    private void deliver(NotificationEnvelope envelope) {
        try {
            send(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + envelope.getType() + " event", e);
        }
    }

    /**
     * Drop every subscription and complete the outbound stream
     */
    void close() {
        subscriptions.values().forEach(Disposable::dispose);
        subscriptions.clear();
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
        log.debug("Client {} disconnected, {} frame(s) dropped", clientId, dropped.get());
    }

    long droppedFrames() {
        return dropped.get();
    }

    int subscriptionCount() {
        return subscriptions.size();
    }

    private ObjectNode reply(String type) {
        return objectMapper.createObjectNode().put("type", type);
    }

    private ObjectNode error(String message) {
        return reply("error").put("message", message);
    }

    private void send(ObjectNode frame) {
        send(frame.toString());
    }

    private void send(String frame) {
        Sinks.EmitResult result;
        synchronized (outbound) {
            result = outbound.tryEmitNext(frame);
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            if (dropped.incrementAndGet() == 1) {
                log.warn("Client {} is not keeping up, dropping frames", clientId);
            }
        } else if (result.isFailure()) {
            log.debug("Frame for client {} not sent: {}", clientId, result);
        }
    }
}
