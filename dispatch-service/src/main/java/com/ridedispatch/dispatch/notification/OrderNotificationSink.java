package com.ridedispatch.dispatch.notification;

/**
 * One delivery channel for order transitions. Sinks are invoked in {@code @Order}
 * sequence and may throw; the notifier isolates each failure.
 */
public interface OrderNotificationSink {

    String name();

    void deliver(OrderNotification notification);
}
