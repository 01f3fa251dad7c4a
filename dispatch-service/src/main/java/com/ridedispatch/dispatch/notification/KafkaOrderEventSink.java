package com.ridedispatch.dispatch.notification;

import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.messaging.EventPublisher;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.events.OrderStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@Order(2)
@RequiredArgsConstructor
public class KafkaOrderEventSink implements OrderNotificationSink {

    private final EventPublisher eventPublisher;

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public void deliver(OrderNotification notification) {
        DispatchOrder order = notification.order();
        OrderStatusChangedEvent event = OrderStatusChangedEvent.builder()
                .orderId(order.getId().toString())
                .type(order.getType())
                .riderId(order.getRiderId())
                .driverId(order.getDriverId() != null ? order.getDriverId() : order.getReleasedDriverId())
                .previousStatus(notification.previousStatus())
                .status(order.getStatus())
                .actorId(notification.actorId())
                .reason(notification.reason())
                .finalFare(order.getFinalFare())
                .changedAt(Instant.now())
                .build();
        eventPublisher.publish(topicFor(order.getStatus()), event.getOrderId(), event);
    }

    static String topicFor(OrderStatus status) {
        return switch (status) {
            case DRIVER_ASSIGNED -> OrderStatusChangedEvent.TOPIC_ACCEPTED;
            case CANCELLED -> OrderStatusChangedEvent.TOPIC_CANCELLED;
            default -> OrderStatusChangedEvent.TOPIC_CHANGED;
        };
    }
}
