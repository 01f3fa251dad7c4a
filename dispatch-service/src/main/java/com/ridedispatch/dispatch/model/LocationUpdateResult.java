package com.ridedispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param distanceMeters movement since the last stored position; absent on a driver's first report
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationUpdateResult(boolean updated, Double distanceMeters) {

    public static LocationUpdateResult suppressed(double distanceMeters) {
        return new LocationUpdateResult(false, distanceMeters);
    }

    public static LocationUpdateResult accepted(Double distanceMeters) {
        return new LocationUpdateResult(true, distanceMeters);
    }
}
