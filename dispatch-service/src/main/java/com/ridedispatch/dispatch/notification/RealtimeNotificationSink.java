package com.ridedispatch.dispatch.notification;

import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.realtime.RealtimeGateway;
import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Order(1)
@RequiredArgsConstructor
public class RealtimeNotificationSink implements OrderNotificationSink {

    private final RealtimeGateway realtimeGateway;

    @Override
    public String name() {
        return "realtime";
    }

    @Override
    public void deliver(OrderNotification notification) {
        RealtimeMessage message = RealtimeMessage.of(RealtimeMessage.ORDER_UPDATE, payload(notification));
        for (String recipient : notification.recipients()) {
            realtimeGateway.sendTo(recipient, message);
        }
    }

    static Map<String, Object> payload(OrderNotification notification) {
        DispatchOrder order = notification.order();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getId());
        payload.put("status", order.getStatus());
        payload.put("previousStatus", notification.previousStatus());
        payload.put("type", order.getType());
        if (order.getDriverId() != null) {
            payload.put("driverId", order.getDriverId());
        }
        if (notification.driver() != null) {
            payload.put("driver", notification.driver());
        }
        if (notification.reason() != null) {
            payload.put("reason", notification.reason());
        }
        if (order.getCancelledBy() != null) {
            payload.put("cancelledBy", order.getCancelledBy());
        }
        if (order.getFinalFare() != null) {
            payload.put("finalFare", order.getFinalFare());
        }
        return payload;
    }
}
