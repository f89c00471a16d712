package com.whereq.orchestra.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process notification bus. The subscriber registry is the only structure touched by many
 * unrelated connections, so it is built from concurrent collections; publishers take no lock.
 */
@Slf4j
@Component
public class LocalNotificationBus implements NotificationBus {

    private final Map<String, Set<NotificationListener>> subscribers = new ConcurrentHashMap<>();

    @Override
    public PublishResult publish(NotificationEnvelope envelope) {
        String channel = envelope.getChannel();
        Set<NotificationListener> listeners = subscribers.get(channel);
        if (listeners == null || listeners.isEmpty()) {
            log.trace("No subscribers on {}", channel);
            return PublishResult.delivered(channel, 0);
        }

        int delivered = 0;
        int failed = 0;
        RuntimeException firstError = null;
        for (NotificationListener listener : listeners) {
            try {
                listener.onEvent(envelope);
                delivered++;
            } catch (RuntimeException e) {
                failed++;
                if (firstError == null) {
                    firstError = e;
                }
            }
        }

        if (failed > 0) {
            log.warn("Publish on {} reached {} of {} subscriber(s): {}",
                channel, delivered, delivered + failed, firstError.getMessage());
            return PublishResult.failed(channel, delivered, failed, firstError);
        }
        return PublishResult.delivered(channel, delivered);
    }

    @Override
    public Disposable subscribe(String channel, NotificationListener listener) {
        subscribers.compute(channel, (key, listeners) -> {
            Set<NotificationListener> updated = listeners != null ? listeners : new CopyOnWriteArraySet<>();
            updated.add(listener);
            return updated;
        });
        log.debug("Subscribed listener to {}", channel);
        return () -> unsubscribe(channel, listener);
    }

    @Override
    public int subscriberCount(String channel) {
        Set<NotificationListener> listeners = subscribers.get(channel);
        return listeners == null ? 0 : listeners.size();
    }

    private void unsubscribe(String channel, NotificationListener listener) {
        subscribers.computeIfPresent(channel, (key, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }
}
