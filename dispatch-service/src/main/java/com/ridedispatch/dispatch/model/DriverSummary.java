package com.ridedispatch.dispatch.model;

import com.ridedispatch.shared.enums.VehicleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a driver as shown to riders.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverSummary {
    private String id;
    private String displayName;
    private VehicleType vehicleType;
    private String vehiclePlate;
    private String vehicleModel;
    private String vehicleColor;
    private double rating;
    private Double latitude;
    private Double longitude;
    private Integer etaMinutes;
}
