package com.ridedispatch.dispatch.model;

import com.ridedispatch.shared.enums.VehicleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverCandidate {
    private String driverId;
    private double distanceKm;
    private int etaMinutes;
    private VehicleType vehicleType;
    private double rating;
}
