package com.ridedispatch.dispatch.model;

import com.ridedispatch.shared.enums.AvailabilityType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityRequest {

    @NotNull
    private Boolean online;

    /** Unchanged when absent. */
    private AvailabilityType availabilityType;
}
