package com.whereq.orchestra.notification;

import lombok.Value;

/**
 * Outcome of a publish. Callers are free to ignore it.
 */
@Value
public class PublishResult {

    String channel;

    int delivered;

    int failed;

    /**
     * First listener or transport error, if any
     */
    Throwable error;

    public static PublishResult delivered(String channel, int delivered) {
        return new PublishResult(channel, delivered, 0, null);
    }

    public static PublishResult failed(String channel, int delivered, int failed, Throwable error) {
        return new PublishResult(channel, delivered, failed, error);
    }

    public boolean isClean() {
        return failed == 0 && error == null;
    }
}
