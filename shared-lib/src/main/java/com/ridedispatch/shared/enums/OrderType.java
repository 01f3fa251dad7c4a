package com.ridedispatch.shared.enums;

public enum OrderType {
    RIDE,
    DELIVERY
}
