package com.ridedispatch.shared.enums;

public enum VehicleType {
    CAR,
    MOTORCYCLE,
    BICYCLE,
    VAN
}
