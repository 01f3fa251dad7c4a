package com.ridedispatch.dispatch.service;

import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.dispatch.repository.OrderRepository;
import com.ridedispatch.shared.enums.OrderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Transactional half of an accept. The driver row is locked first, so two accepts by
 * the same driver run one after the other and the second sees the first's assignment.
 */
@Service
@RequiredArgsConstructor
public class DriverAssignmentService {

    public enum Outcome { ASSIGNED, DRIVER_BUSY, ORDER_TAKEN }

    private final OrderRepository orderRepository;
    private final DriverRepository driverRepository;

    @Transactional
    public Outcome assign(UUID orderId, String driverId, Instant now) {
        driverRepository.lockById(driverId);
        if (orderRepository.existsByDriverIdAndStatusIn(driverId, OrderStatus.ACTIVE_WITH_DRIVER)) {
            return Outcome.DRIVER_BUSY;
        }
        return orderRepository.assignDriverIfPending(orderId, driverId, now) == 1
                ? Outcome.ASSIGNED
                : Outcome.ORDER_TAKEN;
    }
}
