package com.ridedispatch.dispatch.model;

import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class CreateOrderRequest extends EstimateRequest {

    @Size(max = 255)
    private String pickupAddress;

    @Size(max = 255)
    private String dropoffAddress;

    @Size(max = 500)
    private String notes;
}
