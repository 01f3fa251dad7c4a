package com.ridedispatch.dispatch.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs every sink after a transition has committed. A failing sink never rolls
 * back the transition nor stops the sinks after it.
 */
@Slf4j
@Component
public class OrderNotifier {

    private final List<OrderNotificationSink> sinks;

    public OrderNotifier(List<OrderNotificationSink> sinks) {
        this.sinks = List.copyOf(sinks);
        log.info("Order notification sinks: {}", this.sinks.stream().map(OrderNotificationSink::name).toList());
    }

    public void notify(OrderNotification notification) {
        for (OrderNotificationSink sink : sinks) {
            try {
                sink.deliver(notification);
            } catch (RuntimeException e) {
                log.warn("Sink {} failed for order {} ({}): {}", sink.name(),
                        notification.order().getId(), notification.order().getStatus(), e.getMessage());
            }
        }
    }
}
