package com.whereq.orchestra.notification;

import reactor.core.Disposable;

/**
 * Best-effort, at-most-once fan-out of events to channel subscribers.
 * No history is kept: a subscriber only sees events published after it subscribed.
 */
public interface NotificationBus {

    /**
     * Deliver an event to the current subscribers of {@code envelope.channel}.
     * Never throws; problems are reported in the returned result and logged.
     */
    PublishResult publish(NotificationEnvelope envelope);

    /**
     * Register a listener on a channel
     *
     * @return handle that removes the registration when disposed
     */
    Disposable subscribe(String channel, NotificationListener listener);

    int subscriberCount(String channel);
}
