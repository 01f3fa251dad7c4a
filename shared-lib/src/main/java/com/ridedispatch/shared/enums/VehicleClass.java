package com.ridedispatch.shared.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Fare/eligibility selector of an order.
 *
 * Ride classes require a driver with the matching vehicle type; delivery classes
 * describe the package size and can be served by any vehicle.
 */
public enum VehicleClass {
    CAR(OrderType.RIDE, VehicleType.CAR),
    MOTORCYCLE(OrderType.RIDE, VehicleType.MOTORCYCLE),
    BICYCLE(OrderType.RIDE, VehicleType.BICYCLE),
    SMALL(OrderType.DELIVERY, null),
    MEDIUM(OrderType.DELIVERY, null),
    LARGE(OrderType.DELIVERY, null);

    private final OrderType orderType;
    private final VehicleType requiredVehicle;

    VehicleClass(OrderType orderType, VehicleType requiredVehicle) {
        this.orderType = orderType;
        this.requiredVehicle = requiredVehicle;
    }

    public OrderType getOrderType() {
        return orderType;
    }

    public boolean isServedBy(VehicleType vehicleType) {
        return requiredVehicle == null || requiredVehicle == vehicleType;
    }

    public static VehicleClass defaultFor(OrderType type) {
        return type == OrderType.DELIVERY ? SMALL : CAR;
    }

    /**
     * Resolves a free-text class code for the given order type.
     * Blank codes resolve to the type's default; unknown codes and codes of the
     * other order type resolve to empty.
     */
    public static Optional<VehicleClass> resolve(OrderType type, String code) {
        if (code == null || code.isBlank()) {
            return Optional.of(defaultFor(type));
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (VehicleClass candidate : values()) {
            if (candidate.name().equals(normalized) && candidate.orderType == type) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
