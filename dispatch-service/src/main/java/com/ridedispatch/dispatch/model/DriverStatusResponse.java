package com.ridedispatch.dispatch.model;

import com.ridedispatch.shared.enums.AvailabilityType;
import com.ridedispatch.shared.enums.VehicleType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class DriverStatusResponse {
    private String id;
    private boolean online;
    private AvailabilityType availabilityType;
    private VehicleType vehicleType;
    private double rating;
    private int totalRides;
    private int totalDeliveries;
    private Double latitude;
    private Double longitude;
    private Instant lastLocationUpdate;
}
