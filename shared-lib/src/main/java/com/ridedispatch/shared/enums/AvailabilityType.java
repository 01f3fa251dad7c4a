package com.ridedispatch.shared.enums;

/**
 * Which kinds of orders a driver is willing to take.
 */
public enum AvailabilityType {
    RIDE,
    DELIVERY,
    BOTH;

    public boolean accepts(OrderType type) {
        return this == BOTH || name().equals(type.name());
    }
}
