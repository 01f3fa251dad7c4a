package com.ridedispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangedEvent {

    public static final String TOPIC_ACCEPTED  = "order.accepted";
    public static final String TOPIC_CHANGED   = "order.status.changed";
    public static final String TOPIC_CANCELLED = "order.cancelled";

    private String orderId;
    private OrderType type;
    private String riderId;
    private String driverId;
    private OrderStatus previousStatus;
    private OrderStatus status;
    private String actorId;
    private String reason;
    private BigDecimal finalFare;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
