package com.ridedispatch.shared.enums;

import java.util.Locale;

public enum ConnectionRole {
    RIDER,
    DRIVER;

    public static ConnectionRole fromParam(String value) {
        if (value != null && "driver".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return DRIVER;
        }
        return RIDER;
    }
}
