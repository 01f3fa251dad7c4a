package com.ridedispatch.shared.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @Test
    @DisplayName("Forward transitions follow the lifecycle one step at a time")
    void forwardTransitions() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.DRIVER_ASSIGNED)).isTrue();
        assertThat(OrderStatus.DRIVER_ASSIGNED.canTransitionTo(OrderStatus.DRIVER_ARRIVING)).isTrue();
        assertThat(OrderStatus.DRIVER_ARRIVING.canTransitionTo(OrderStatus.DRIVER_ARRIVED)).isTrue();
        assertThat(OrderStatus.DRIVER_ARRIVED.canTransitionTo(OrderStatus.IN_PROGRESS)).isTrue();
        assertThat(OrderStatus.IN_PROGRESS.canTransitionTo(OrderStatus.COMPLETED)).isTrue();
    }

    @Test
    @DisplayName("Skipping a step or moving backwards is rejected")
    void illegalTransitions() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.IN_PROGRESS)).isFalse();
        assertThat(OrderStatus.DRIVER_ASSIGNED.canTransitionTo(OrderStatus.DRIVER_ARRIVED)).isFalse();
        assertThat(OrderStatus.IN_PROGRESS.canTransitionTo(OrderStatus.DRIVER_ARRIVED)).isFalse();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("Every non-terminal status can be cancelled, terminal ones cannot move")
    void cancellationAndTerminals() {
        for (OrderStatus status : OrderStatus.ACTIVE) {
            assertThat(status.canTransitionTo(OrderStatus.CANCELLED)).as(status.name()).isTrue();
        }
        for (OrderStatus next : OrderStatus.values()) {
            assertThat(OrderStatus.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(OrderStatus.CANCELLED.canTransitionTo(next)).isFalse();
        }
    }
}
