package com.ridedispatch.dispatch.model;

import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEstimate {
    private OrderType type;
    private VehicleClass vehicleClass;
    private double distanceKm;
    private int durationMinutes;
    private BigDecimal fare;
    private FareBreakdown fareBreakdown;
    private double surgeMultiplier;
    private int nearbyDrivers;
    private int estimatedPickupMinutes;
}
