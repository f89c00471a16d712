package com.whereq.orchestra.notification;

@FunctionalInterface
public interface NotificationListener {

    void onEvent(NotificationEnvelope envelope);
}
