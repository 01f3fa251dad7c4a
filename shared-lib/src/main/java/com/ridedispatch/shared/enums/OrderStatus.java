package com.ridedispatch.shared.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle. PENDING means the order is still searching for a driver.
 */
public enum OrderStatus {
    PENDING,
    DRIVER_ASSIGNED,
    DRIVER_ARRIVING,
    DRIVER_ARRIVED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /** Statuses in which an order has a driver attached. */
    public static final Set<OrderStatus> WITH_DRIVER =
            EnumSet.of(DRIVER_ASSIGNED, DRIVER_ARRIVING, DRIVER_ARRIVED, IN_PROGRESS, COMPLETED);

    /** Statuses in which an order still occupies its driver. */
    public static final Set<OrderStatus> ACTIVE_WITH_DRIVER =
            EnumSet.of(DRIVER_ASSIGNED, DRIVER_ARRIVING, DRIVER_ARRIVED, IN_PROGRESS);

    /** Non-terminal statuses. */
    public static final Set<OrderStatus> ACTIVE =
            EnumSet.of(PENDING, DRIVER_ASSIGNED, DRIVER_ARRIVING, DRIVER_ARRIVED, IN_PROGRESS);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == DRIVER_ASSIGNED;
            case DRIVER_ASSIGNED -> next == DRIVER_ARRIVING;
            case DRIVER_ARRIVING -> next == DRIVER_ARRIVED;
            case DRIVER_ARRIVED -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED;
            default -> false;
        };
    }
}
