package com.ridedispatch.shared.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VehicleClassTest {

    @Test
    @DisplayName("Blank selector falls back to the order type's default class")
    void blankResolvesToDefault() {
        assertThat(VehicleClass.resolve(OrderType.RIDE, null)).contains(VehicleClass.CAR);
        assertThat(VehicleClass.resolve(OrderType.DELIVERY, " ")).contains(VehicleClass.SMALL);
    }

    @Test
    @DisplayName("Codes are case-insensitive but must belong to the order type")
    void resolvesKnownCodes() {
        assertThat(VehicleClass.resolve(OrderType.RIDE, "motorcycle")).contains(VehicleClass.MOTORCYCLE);
        assertThat(VehicleClass.resolve(OrderType.DELIVERY, "Large")).contains(VehicleClass.LARGE);
        assertThat(VehicleClass.resolve(OrderType.RIDE, "LARGE")).isEmpty();
        assertThat(VehicleClass.resolve(OrderType.RIDE, "HOVERCRAFT")).isEmpty();
    }

    @Test
    @DisplayName("Ride classes need a matching vehicle, delivery classes take any vehicle")
    void vehicleEligibility() {
        assertThat(VehicleClass.CAR.isServedBy(VehicleType.CAR)).isTrue();
        assertThat(VehicleClass.CAR.isServedBy(VehicleType.MOTORCYCLE)).isFalse();
        assertThat(VehicleClass.MEDIUM.isServedBy(VehicleType.BICYCLE)).isTrue();
        assertThat(AvailabilityType.BOTH.accepts(OrderType.DELIVERY)).isTrue();
        assertThat(AvailabilityType.RIDE.accepts(OrderType.DELIVERY)).isFalse();
    }
}
