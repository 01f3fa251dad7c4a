package com.ridedispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {
    private UUID id;
    private OrderType type;
    private OrderStatus status;
    private String riderId;
    private String driverId;
    private DriverSummary driver;
    private VehicleClass vehicleClass;
    private double pickupLat;
    private double pickupLng;
    private String pickupAddress;
    private double dropoffLat;
    private double dropoffLng;
    private String dropoffAddress;
    private String notes;
    private double distanceKm;
    private int durationMinutes;
    private BigDecimal estimatedFare;
    private double surgeMultiplier;
    private BigDecimal finalFare;
    /** Only shown to the rider, who reads it out to the driver at pickup. */
    private String otp;
    private int broadcastCount;
    private Instant searchExpiresAt;
    private String cancelledBy;
    private String cancellationReason;
    private Instant createdAt;
    private Instant acceptedAt;
    private Instant arrivedAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant cancelledAt;
}
