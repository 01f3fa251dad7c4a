package com.ridedispatch.dispatch.notification;

import com.ridedispatch.shared.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Hand-off point for mobile push. Delivery itself (FCM/APNs) is owned by the
 * notification platform; this sink only records what would be sent.
 */
@Slf4j
@Component
@Order(3)
public class PushNotificationSink implements OrderNotificationSink {

    @Override
    public String name() {
        return "push";
    }

    @Override
    public void deliver(OrderNotification notification) {
        String title = titleFor(notification.order().getStatus());
        for (String recipient : notification.recipients()) {
            log.info("[PUSH] recipient={} order={} title='{}'", recipient, notification.order().getId(), title);
        }
    }

    static String titleFor(OrderStatus status) {
        return switch (status) {
            case DRIVER_ASSIGNED -> "Driver on the way";
            case DRIVER_ARRIVING -> "Driver is arriving";
            case DRIVER_ARRIVED -> "Driver has arrived";
            case IN_PROGRESS -> "Trip started";
            case COMPLETED -> "Trip completed";
            case CANCELLED -> "Order cancelled";
            default -> "Order update";
        };
    }
}
