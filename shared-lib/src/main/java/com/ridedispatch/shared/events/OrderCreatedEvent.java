package com.ridedispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
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
public class OrderCreatedEvent {

    public static final String TOPIC = "order.created";

    private String orderId;
    private String riderId;
    private OrderType type;
    private VehicleClass vehicleClass;
    private double pickupLat;
    private double pickupLng;
    private double dropoffLat;
    private double dropoffLng;
    private double distanceKm;
    private int durationMinutes;
    private BigDecimal estimatedFare;
    private double surgeMultiplier;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;
}
