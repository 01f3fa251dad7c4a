package com.ridedispatch.dispatch.model;

import com.ridedispatch.shared.enums.OrderType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EstimateRequest {

    @NotNull
    private OrderType type;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    /** CAR, MOTORCYCLE, BICYCLE for rides; SMALL, MEDIUM, LARGE for deliveries. */
    private String vehicleClass;
}
