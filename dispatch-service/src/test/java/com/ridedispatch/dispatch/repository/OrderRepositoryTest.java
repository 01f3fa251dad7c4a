package com.ridedispatch.dispatch.repository;

import com.ridedispatch.dispatch.entity.DeclineRecord;
import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.service.DriverAssignmentService;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import com.ridedispatch.shared.enums.VehicleType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(DriverAssignmentService.class)
class OrderRepositoryTest {

    @Autowired private OrderRepository orderRepository;
    @Autowired private DeclineRecordRepository declineRecordRepository;
    @Autowired private DriverRepository driverRepository;
    @Autowired private DriverAssignmentService assignmentService;

    private final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    @Test
    @DisplayName("Only the first conditional assign on a PENDING order succeeds")
    void assignIsCompareAndSet() {
        UUID id = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();

        assertThat(orderRepository.assignDriverIfPending(id, "drv-A", now)).isEqualTo(1);
        assertThat(orderRepository.assignDriverIfPending(id, "drv-B", now)).isZero();

        DispatchOrder order = orderRepository.findById(id).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.DRIVER_ASSIGNED);
        assertThat(order.getDriverId()).isEqualTo("drv-A");
        assertThat(order.getSearchExpiresAt()).isNull();
        assertThat(order.getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("A driver already holding an active order cannot be assigned a second one")
    void assignRejectsBusyDriver() {
        UUID first = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        UUID second = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();

        assertThat(orderRepository.assignDriverIfPending(first, "drv-A", now)).isEqualTo(1);
        assertThat(orderRepository.assignDriverIfPending(second, "drv-A", now)).isZero();

        DispatchOrder untouched = orderRepository.findById(second).orElseThrow();
        assertThat(untouched.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(untouched.getDriverId()).isNull();
        assertThat(orderRepository.assignDriverIfPending(second, "drv-B", now)).isEqualTo(1);
    }

    @Test
    @DisplayName("Once the driver's order ends, the driver can be assigned again")
    void assignAfterPreviousOrderEnds() {
        UUID first = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        UUID second = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        orderRepository.assignDriverIfPending(first, "drv-A", now);
        orderRepository.cancelIfActive(first, "rider-1", null, now);

        assertThat(orderRepository.assignDriverIfPending(second, "drv-A", now)).isEqualTo(1);
    }

    @Test
    @DisplayName("Assignment locks the driver row and reports a busy driver or a taken order")
    void assignmentOutcomes() {
        driverRepository.saveAndFlush(driver("drv-A"));
        driverRepository.saveAndFlush(driver("drv-B"));
        UUID first = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        UUID second = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();

        assertThat(driverRepository.lockById("drv-A")).isPresent();
        assertThat(assignmentService.assign(first, "drv-A", now)).isEqualTo(DriverAssignmentService.Outcome.ASSIGNED);
        assertThat(assignmentService.assign(second, "drv-A", now)).isEqualTo(DriverAssignmentService.Outcome.DRIVER_BUSY);
        assertThat(assignmentService.assign(first, "drv-B", now)).isEqualTo(DriverAssignmentService.Outcome.ORDER_TAKEN);
    }

    @Test
    @DisplayName("Cancelling an active order releases its driver, whatever the row's version")
    void cancelIfActiveReleasesDriver() {
        UUID id = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        orderRepository.assignDriverIfPending(id, "drv-A", now);
        long versionBefore = orderRepository.findById(id).orElseThrow().getVersion();

        assertThat(orderRepository.cancelIfActive(id, "rider-1", "changed plans", now)).isEqualTo(1);

        DispatchOrder cancelled = orderRepository.findById(id).orElseThrow();
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.getDriverId()).isNull();
        assertThat(cancelled.getReleasedDriverId()).isEqualTo("drv-A");
        assertThat(cancelled.getCancelledBy()).isEqualTo("rider-1");
        assertThat(cancelled.getCancellationReason()).isEqualTo("changed plans");
        assertThat(cancelled.getCancelledAt()).isEqualTo(now);
        assertThat(cancelled.getVersion()).isEqualTo(versionBefore + 1);
    }

    @Test
    @DisplayName("A searching order is cancelled even after a broadcast bumped its version")
    void cancelIfActiveIgnoresConcurrentRenewal() {
        UUID id = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        orderRepository.renewSearch(id, now.plusSeconds(60));

        assertThat(orderRepository.cancelIfActive(id, "rider-1", null, now)).isEqualTo(1);

        DispatchOrder cancelled = orderRepository.findById(id).orElseThrow();
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.getReleasedDriverId()).isNull();
        assertThat(cancelled.getSearchExpiresAt()).isNull();
    }

    @Test
    @DisplayName("Orders that already ended are not cancelled again")
    void cancelIfActiveSkipsEndedOrders() {
        DispatchOrder completed = pending(null);
        completed.setStatus(OrderStatus.COMPLETED);
        UUID completedId = orderRepository.saveAndFlush(completed).getId();
        UUID cancelledId = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        orderRepository.cancelIfActive(cancelledId, "rider-1", "first", now);

        assertThat(orderRepository.cancelIfActive(completedId, "rider-1", null, now)).isZero();
        assertThat(orderRepository.cancelIfActive(cancelledId, "rider-1", "second", now)).isZero();
        assertThat(orderRepository.findById(cancelledId).orElseThrow().getCancellationReason()).isEqualTo("first");
    }

    @Test
    @DisplayName("Renewing a search moves the lease and counts the round, but only while PENDING")
    void renewSearch() {
        UUID id = orderRepository.saveAndFlush(pending(now)).getId();
        Instant next = now.plusSeconds(30);

        assertThat(orderRepository.renewSearch(id, next)).isEqualTo(1);
        DispatchOrder renewed = orderRepository.findById(id).orElseThrow();
        assertThat(renewed.getSearchExpiresAt()).isEqualTo(next);
        assertThat(renewed.getBroadcastCount()).isEqualTo(1);

        orderRepository.assignDriverIfPending(id, "drv-A", now);
        assertThat(orderRepository.renewSearch(id, next.plusSeconds(30))).isZero();
    }

    @Test
    @DisplayName("An expired lease can be claimed once; a second claim on the same lease value fails")
    void claimExpiredSearchOnce() {
        Instant expired = now.minusSeconds(1);
        UUID id = orderRepository.saveAndFlush(pending(expired)).getId();

        assertThat(orderRepository.claimExpiredSearch(id, expired, now.plusSeconds(30))).isEqualTo(1);
        assertThat(orderRepository.claimExpiredSearch(id, expired, now.plusSeconds(30))).isZero();
        assertThat(orderRepository.findById(id).orElseThrow().getSearchExpiresAt()).isEqualTo(now.plusSeconds(30));
    }

    @Test
    @DisplayName("Only PENDING orders with a lapsed lease are returned, oldest first")
    void findExpiredSearches() {
        UUID older = orderRepository.saveAndFlush(pending(now.minusSeconds(20))).getId();
        UUID newer = orderRepository.saveAndFlush(pending(now.minusSeconds(5))).getId();
        orderRepository.saveAndFlush(pending(now.plusSeconds(25)));
        UUID assigned = orderRepository.saveAndFlush(pending(now.minusSeconds(10))).getId();
        orderRepository.assignDriverIfPending(assigned, "drv-A", now);

        List<DispatchOrder> expired = orderRepository.findExpiredSearches(now, PageRequest.of(0, 10));

        assertThat(expired).extracting(DispatchOrder::getId).containsExactly(older, newer);
    }

    @Test
    @DisplayName("Declines are listed per order and unique per driver")
    void declinesPerOrder() {
        UUID id = orderRepository.saveAndFlush(pending(now.plusSeconds(30))).getId();
        declineRecordRepository.saveAndFlush(DeclineRecord.builder().orderId(id).driverId("drv-A").build());
        declineRecordRepository.saveAndFlush(DeclineRecord.builder().orderId(id).driverId("drv-B").build());

        assertThat(declineRecordRepository.findDriverIdsByOrderId(id)).containsExactlyInAnyOrder("drv-A", "drv-B");
        assertThat(declineRecordRepository.existsByOrderIdAndDriverId(id, "drv-A")).isTrue();
        assertThat(declineRecordRepository.existsByOrderIdAndDriverId(id, "drv-C")).isFalse();
        assertThat(declineRecordRepository.countByOrderId(id)).isEqualTo(2);
    }

    @Test
    @DisplayName("History includes orders a driver was released from")
    void historyIncludesReleasedDriver() {
        DispatchOrder cancelled = pending(null);
        cancelled.setStatus(OrderStatus.CANCELLED);
        cancelled.setReleasedDriverId("drv-A");
        orderRepository.saveAndFlush(cancelled);
        orderRepository.saveAndFlush(pending(now.plusSeconds(30)));

        assertThat(orderRepository.findHistory("user-A", "drv-A", PageRequest.of(0, 10)).getContent())
                .extracting(DispatchOrder::getStatus)
                .containsExactly(OrderStatus.CANCELLED);
    }

    private static Driver driver(String id) {
        return Driver.builder()
                .id(id)
                .userId("user-" + id)
                .online(true)
                .vehicleType(VehicleType.CAR)
                .build();
    }

    private static DispatchOrder pending(Instant searchExpiresAt) {
        return DispatchOrder.builder()
                .type(OrderType.RIDE)
                .status(OrderStatus.PENDING)
                .riderId("rider-1")
                .vehicleClass(VehicleClass.CAR)
                .pickupLat(34.0)
                .pickupLng(-6.8)
                .dropoffLat(34.02)
                .dropoffLng(-6.83)
                .distanceKm(4.2)
                .durationMinutes(9)
                .estimatedFare(new BigDecimal("9.80"))
                .surgeMultiplier(1.0)
                .otp("1234")
                .searchExpiresAt(searchExpiresAt)
                .build();
    }
}
