package com.ridedispatch.dispatch.service;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.dispatch.entity.DeclineRecord;
import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.entity.OrderEvent;
import com.ridedispatch.dispatch.entity.OrderEvent.OrderEventType;
import com.ridedispatch.dispatch.exception.DispatchException;
import com.ridedispatch.dispatch.exception.ErrorCode;
import com.ridedispatch.dispatch.messaging.EventPublisher;
import com.ridedispatch.dispatch.metrics.DispatchMetrics;
import com.ridedispatch.dispatch.model.CreateOrderRequest;
import com.ridedispatch.dispatch.model.DriverCandidate;
import com.ridedispatch.dispatch.model.DriverSummary;
import com.ridedispatch.dispatch.model.EstimateRequest;
import com.ridedispatch.dispatch.model.FareBreakdown;
import com.ridedispatch.dispatch.model.OrderEstimate;
import com.ridedispatch.dispatch.model.OrderResponse;
import com.ridedispatch.dispatch.model.UpdateStatusRequest;
import com.ridedispatch.dispatch.notification.OrderNotification;
import com.ridedispatch.dispatch.notification.OrderNotifier;
import com.ridedispatch.dispatch.realtime.RealtimeGateway;
import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import com.ridedispatch.dispatch.repository.DeclineRecordRepository;
import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.dispatch.repository.OrderEventRepository;
import com.ridedispatch.dispatch.repository.OrderRepository;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import com.ridedispatch.shared.events.OrderCreatedEvent;
import com.ridedispatch.shared.events.OrderOfferSentEvent;
import com.ridedispatch.shared.featureflag.FeatureFlagService;
import com.ridedispatch.shared.util.GeoUtils;
import com.ridedispatch.shared.util.KafkaTopics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Core dispatch orchestration logic.
 *
 * Dispatch flow:
 *  1. Kill switch and idempotency checks, then persist the order as PENDING with a fresh OTP
 *  2. Broadcast: under a per-order Redisson lock, rank candidates (GeoIndex + durable filters),
 *     excluding every driver with a DeclineRecord, renew the accept-window lease
 *     ({@code searchExpiresAt}) and push {@code new_order_request} to each candidate
 *  3. Accept: single conditional UPDATE ... WHERE status = PENDING; exactly one driver wins
 *  4. Decline: DeclineRecord appended, immediate rebroadcast
 *  5. Timeout: OfferTimeoutScheduler claims the expired lease and calls {@link #handleSearchTimeout}
 *  6. Status updates and cancel validated against the transition table, then fanned out
 *     through OrderNotifier after the write has committed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchOrchestrator {

    public static final String SYSTEM_ACTOR = "system";
    public static final String NO_DRIVERS_AVAILABLE = "NO_DRIVERS_AVAILABLE";

    private static final String LOCK_PREFIX = "lock:order:";
    private static final SecureRandom OTP_RANDOM = new SecureRandom();

    private final OrderRepository orderRepository;
    private final DriverRepository driverRepository;
    private final DeclineRecordRepository declineRecordRepository;
    private final OrderEventRepository orderEventRepository;
    private final DriverCandidateService candidateService;
    private final DriverAssignmentService assignmentService;
    private final FareEstimator fareEstimator;
    private final RealtimeGateway realtimeGateway;
    private final OrderNotifier orderNotifier;
    private final EventPublisher eventPublisher;
    private final RedissonClient redissonClient;
    private final FeatureFlagService featureFlagService;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    // ---------------------------------------------------------------- estimate

    public OrderEstimate estimate(EstimateRequest req) {
        VehicleClass vehicleClass = resolveVehicleClass(req.getType(), req.getVehicleClass());
        GeoUtils.RouteEstimate route = GeoUtils.estimateRoute(
                req.getPickupLat(), req.getPickupLng(), req.getDropoffLat(), req.getDropoffLng());

        List<DriverCandidate> nearby = candidateService.findCandidates(
                req.getPickupLat(), req.getPickupLng(), req.getType(), vehicleClass, List.of(),
                properties.getSearch().getEstimateCandidateLimit());
        FareBreakdown fare = fareEstimator.calculate(
                vehicleClass, route.distanceKm(), route.durationMinutes(), nearby.size());

        return OrderEstimate.builder()
                .type(req.getType())
                .vehicleClass(vehicleClass)
                .distanceKm(route.distanceKm())
                .durationMinutes(route.durationMinutes())
                .fare(fare.getTotal())
                .fareBreakdown(fare)
                .surgeMultiplier(fare.getSurgeMultiplier())
                .nearbyDrivers(nearby.size())
                .estimatedPickupMinutes(nearby.isEmpty()
                        ? properties.getSearch().getDefaultPickupEtaMinutes()
                        : nearby.get(0).getEtaMinutes())
                .build();
    }

    // ---------------------------------------------------------------- create

    public OrderResponse createOrder(String riderId, CreateOrderRequest req, String idempotencyKey) {
        // Kill switch: ops can stop all new dispatches instantly via Redis flag
        if (featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)) {
            metrics.recordKillSwitchRejection();
            throw new DispatchException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Dispatch is temporarily disabled for maintenance. Please try again shortly.");
        }

        if (idempotencyKey != null) {
            Optional<DispatchOrder> existing = orderRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                return replay(existing.get(), riderId, idempotencyKey);
            }
        }

        VehicleClass vehicleClass;
        try {
            vehicleClass = resolveVehicleClass(req.getType(), req.getVehicleClass());
        } catch (DispatchException e) {
            metrics.recordOrderRejected();
            throw e;
        }

        Timer.Sample latency = Timer.start();
        OrderEstimate estimate = estimate(req);

        DispatchOrder order = DispatchOrder.builder()
                .type(req.getType())
                .status(OrderStatus.PENDING)
                .riderId(riderId)
                .vehicleClass(vehicleClass)
                .pickupLat(req.getPickupLat())
                .pickupLng(req.getPickupLng())
                .pickupAddress(req.getPickupAddress())
                .dropoffLat(req.getDropoffLat())
                .dropoffLng(req.getDropoffLng())
                .dropoffAddress(req.getDropoffAddress())
                .notes(req.getNotes())
                .distanceKm(estimate.getDistanceKm())
                .durationMinutes(estimate.getDurationMinutes())
                .estimatedFare(estimate.getFare())
                .surgeMultiplier(estimate.getSurgeMultiplier())
                .otp(generateOtp())
                // initial lease; the first broadcast renews it
                .searchExpiresAt(nextSearchExpiry(Instant.now()))
                .broadcastCount(0)
                .idempotencyKey(idempotencyKey)
                .build();

        try {
            order = orderRepository.saveAndFlush(order);
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            // lost a race with a concurrent request carrying the same key
            DispatchOrder winner = orderRepository.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
            return replay(winner, riderId, idempotencyKey);
        }

        recordEvent(order.getId(), OrderEventType.CREATED, OrderStatus.PENDING, riderId, null, null,
                vehicleClass + " " + estimate.getFare());
        eventPublisher.publish(KafkaTopics.ORDER_CREATED, order.getId().toString(), OrderCreatedEvent.builder()
                .orderId(order.getId().toString())
                .riderId(riderId)
                .type(order.getType())
                .vehicleClass(vehicleClass)
                .pickupLat(order.getPickupLat())
                .pickupLng(order.getPickupLng())
                .dropoffLat(order.getDropoffLat())
                .dropoffLng(order.getDropoffLng())
                .distanceKm(order.getDistanceKm())
                .durationMinutes(order.getDurationMinutes())
                .estimatedFare(order.getEstimatedFare())
                .surgeMultiplier(order.getSurgeMultiplier())
                .requestedAt(Instant.now())
                .build());

        log.info("Order {} created by {}: {} {} {}km fare={}", order.getId(), riderId, order.getType(),
                vehicleClass, order.getDistanceKm(), order.getEstimatedFare());

        broadcastOffers(order.getId(), "created");

        latency.stop(metrics.getDispatchLatencyTimer());
        metrics.recordOrderCreated();

        DispatchOrder current = orderRepository.findById(order.getId()).orElse(order);
        return toResponse(current, riderId);
    }

    // ---------------------------------------------------------------- broadcast

    /**
     * Offers a PENDING order to every eligible driver that has not declined it and
     * starts a new accept window. Never throws: a round that fails, or cannot take the
     * order lock, is picked up again by the timeout sweep once the current lease expires.
     */
    public void broadcastOffers(UUID orderId, String trigger) {
        RLock lock;
        try {
            lock = redissonClient.getLock(LOCK_PREFIX + orderId);
            if (!lock.tryLock(2, 10, TimeUnit.SECONDS)) {
                log.warn("Could not acquire lock for order {}, skipping {} broadcast", orderId, trigger);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while acquiring dispatch lock for order {}", orderId, e);
            return;
        } catch (RuntimeException e) {
            log.warn("Dispatch lock for order {} unavailable, leaving the {} broadcast to the timeout sweep: {}",
                    orderId, trigger, e.getMessage());
            return;
        }

        try {
            broadcastLocked(orderId, trigger);
        } catch (DataAccessException e) {
            log.warn("Broadcast of order {} failed, the timeout sweep will retry: {}", orderId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Broadcast of order {} failed, the timeout sweep will retry", orderId, e);
        } finally {
            release(lock, orderId);
        }
    }

    private void broadcastLocked(UUID orderId, String trigger) {
        DispatchOrder order = orderRepository.findById(orderId).orElse(null);
        if (order == null || order.getStatus() != OrderStatus.PENDING) {
            log.debug("Order {} no longer searching, skipping {} broadcast", orderId, trigger);
            return;
        }

        int maxBroadcasts = properties.getSearch().getMaxBroadcasts();
        if (maxBroadcasts > 0 && order.getBroadcastCount() >= maxBroadcasts) {
            log.warn("Order {} reached {} broadcasts without an accept, giving up", orderId, maxBroadcasts);
            cancelBySystem(orderId, NO_DRIVERS_AVAILABLE);
            return;
        }

        List<String> excluded = declineRecordRepository.findDriverIdsByOrderId(orderId);
        List<DriverCandidate> candidates = candidateService.findCandidates(
                order.getPickupLat(), order.getPickupLng(), order.getType(), order.getVehicleClass(),
                excluded, properties.getSearch().getCandidateLimit());

        Instant expiresAt = nextSearchExpiry(Instant.now());
        if (orderRepository.renewSearch(orderId, expiresAt) == 0) {
            log.debug("Order {} left PENDING during {} broadcast", orderId, trigger);
            return;
        }
        int round = order.getBroadcastCount() + 1;

        if (candidates.isEmpty()) {
            metrics.recordNoCandidates();
            log.warn("No drivers available for order {} (round {}, {} excluded); still searching",
                    orderId, round, excluded.size());
            realtimeGateway.sendTo(order.getRiderId(), RealtimeMessage.of(RealtimeMessage.ORDER_UPDATE,
                    searchingPayload(order, expiresAt)));
        } else {
            for (DriverCandidate candidate : candidates) {
                realtimeGateway.sendTo(candidate.getDriverId(), RealtimeMessage.of(
                        RealtimeMessage.NEW_ORDER_REQUEST, offerPayload(order, candidate, expiresAt)));
            }
            metrics.recordOffersSent(candidates.size());
            log.info("Order {} offered to {} drivers (round {}, trigger {}, {} excluded)",
                    orderId, candidates.size(), round, trigger, excluded.size());
        }

        List<String> offeredTo = candidates.stream().map(DriverCandidate::getDriverId).toList();
        recordEvent(orderId, OrderEventType.BROADCAST, OrderStatus.PENDING, SYSTEM_ACTOR, null, null,
                "round " + round + " (" + trigger + "): " + offeredTo.size() + " offers, "
                        + excluded.size() + " excluded");
        eventPublisher.publish(KafkaTopics.ORDER_OFFER_SENT, orderId.toString(), OrderOfferSentEvent.builder()
                .orderId(orderId.toString())
                .driverIds(offeredTo)
                .broadcastNumber(round)
                .excludedCount(excluded.size())
                .expiresAt(expiresAt)
                .build());
    }

    // the lease expires on its own after 10s if Redis is gone before we can release it
    private void release(RLock lock, UUID orderId) {
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            log.warn("Could not release dispatch lock for order {}: {}", orderId, e.getMessage());
        }
    }

    /** Called once per expired accept window, after the sweep has claimed it. */
    public void handleSearchTimeout(UUID orderId) {
        metrics.recordOfferTimeout();
        recordEvent(orderId, OrderEventType.TIMEOUT, OrderStatus.PENDING, SYSTEM_ACTOR, null, null,
                "accept window expired");
        log.info("Accept window of order {} expired, rebroadcasting", orderId);
        broadcastOffers(orderId, "timeout");
    }

    // ---------------------------------------------------------------- accept / decline

    public OrderResponse acceptOrder(UUID orderId, String driverId) {
        Driver driver = requireDriver(driverId);
        if (!driver.isOnline()) {
            throw new DispatchException(ErrorCode.DRIVER_OFFLINE, "Go online before accepting orders");
        }

        DispatchOrder order = requireOrder(orderId);
        if (order.getStatus() != OrderStatus.PENDING) {
            metrics.recordAcceptConflict();
            throw noLongerAvailable(orderId);
        }
        Instant now = Instant.now();
        // exactly one conditional update can match PENDING
        switch (assignmentService.assign(orderId, driverId, now)) {
            case DRIVER_BUSY -> throw new DispatchException(ErrorCode.DRIVER_BUSY,
                    "Driver " + driverId + " already has an active order");
            case ORDER_TAKEN -> {
                metrics.recordAcceptConflict();
                log.info("Driver {} lost the accept race for order {}", driverId, orderId);
                throw noLongerAvailable(orderId);
            }
            case ASSIGNED -> {
            }
        }

        order.setStatus(OrderStatus.DRIVER_ASSIGNED);
        order.setDriverId(driverId);
        order.setAcceptedAt(now);
        order.setSearchExpiresAt(null);

        metrics.recordOfferAccepted();
        recordEvent(orderId, OrderEventType.STATUS_CHANGED, OrderStatus.DRIVER_ASSIGNED, driverId,
                driver.getCurrentLat(), driver.getCurrentLng(), "accepted");
        log.info("Order {} accepted by driver {}", orderId, driverId);

        DriverSummary summary = toDriverSummary(driver, order);
        orderNotifier.notify(new OrderNotification(order, OrderStatus.PENDING, driverId, null,
                List.of(order.getRiderId(), driverId), summary));

        return toResponse(order, driver.getUserId());
    }

    /**
     * Records the decline and immediately rebroadcasts. A decline for an order that
     * is no longer searching is ignored.
     */
    public void declineOrder(UUID orderId, String driverId) {
        requireDriver(driverId);
        DispatchOrder order = requireOrder(orderId);
        if (order.getStatus() != OrderStatus.PENDING) {
            log.debug("Ignoring decline of order {} by {}: status is {}", orderId, driverId, order.getStatus());
            return;
        }

        if (!declineRecordRepository.existsByOrderIdAndDriverId(orderId, driverId)) {
            try {
                declineRecordRepository.save(DeclineRecord.builder().orderId(orderId).driverId(driverId).build());
            } catch (DataIntegrityViolationException e) {
                log.debug("Decline of order {} by {} already recorded", orderId, driverId);
            }
        }
        metrics.recordOfferDeclined();
        recordEvent(orderId, OrderEventType.DECLINED, OrderStatus.PENDING, driverId, null, null, null);
        log.info("Order {} declined by driver {}, rebroadcasting", orderId, driverId);

        broadcastOffers(orderId, "decline");
    }

    // ---------------------------------------------------------------- lifecycle

    public OrderResponse updateStatus(UUID orderId, String actorUserId, UpdateStatusRequest req) {
        if (req.getStatus() == OrderStatus.CANCELLED) {
            return cancelOrder(orderId, actorUserId, req.getReason());
        }

        DispatchOrder order = requireOrder(orderId);
        Driver driver = driverRepository.findByUserId(actorUserId).orElse(null);
        if (driver == null || !driver.getId().equals(order.getDriverId())) {
            throw new DispatchException(ErrorCode.FORBIDDEN, "Only the assigned driver can update order " + orderId);
        }

        OrderStatus previous = order.getStatus();
        OrderStatus next = req.getStatus();
        if (next == OrderStatus.DRIVER_ASSIGNED || !previous.canTransitionTo(next)) {
            throw new DispatchException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Cannot move order " + orderId + " from " + previous + " to " + next);
        }
        if (next == OrderStatus.IN_PROGRESS && !Objects.equals(order.getOtp(), req.getOtp())) {
            throw new DispatchException(ErrorCode.INVALID_OTP, "The pickup code does not match");
        }

        Instant now = Instant.now();
        order.setStatus(next);
        switch (next) {
            case DRIVER_ARRIVED -> order.setArrivedAt(now);
            case IN_PROGRESS -> order.setStartedAt(now);
            case COMPLETED -> {
                order.setCompletedAt(now);
                order.setFinalFare(order.getEstimatedFare());
            }
            default -> {
            }
        }
        order = orderRepository.saveAndFlush(order);

        if (next == OrderStatus.COMPLETED) {
            if (order.getType() == OrderType.DELIVERY) {
                driverRepository.incrementTotalDeliveries(driver.getId());
            } else {
                driverRepository.incrementTotalRides(driver.getId());
            }
        }

        recordEvent(orderId, OrderEventType.STATUS_CHANGED, next, driver.getId(),
                req.getLatitude(), req.getLongitude(), previous + " -> " + next);
        log.info("Order {} moved {} -> {} by driver {}", orderId, previous, next, driver.getId());

        orderNotifier.notify(new OrderNotification(order, previous, driver.getId(), null,
                List.of(order.getRiderId()), toDriverSummary(driver, order)));
        return toResponse(order, actorUserId);
    }

    public OrderResponse cancelOrder(UUID orderId, String actorUserId, String reason) {
        DispatchOrder order = requireOrder(orderId);
        if (order.getStatus() == OrderStatus.COMPLETED) {
            throw new DispatchException(ErrorCode.ORDER_ALREADY_COMPLETED, "Order " + orderId + " is already completed");
        }
        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new DispatchException(ErrorCode.INVALID_STATUS_TRANSITION, "Order " + orderId + " is already cancelled");
        }

        boolean byRider = order.getRiderId().equals(actorUserId);
        String actorDriverId = byRider ? null : driverRepository.findByUserId(actorUserId)
                .map(Driver::getId)
                .filter(id -> id.equals(order.getDriverId()))
                .orElse(null);
        if (!byRider && actorDriverId == null) {
            throw new DispatchException(ErrorCode.FORBIDDEN, "Only the rider or the assigned driver can cancel order " + orderId);
        }

        String actorId = byRider ? actorUserId : actorDriverId;
        OrderStatus previous = order.getStatus();
        DispatchOrder cancelled = applyCancel(orderId, actorId, reason).orElseThrow(() -> {
            DispatchOrder current = requireOrder(orderId);
            return current.getStatus() == OrderStatus.COMPLETED
                    ? new DispatchException(ErrorCode.ORDER_ALREADY_COMPLETED, "Order " + orderId + " is already completed")
                    : new DispatchException(ErrorCode.INVALID_STATUS_TRANSITION, "Order " + orderId + " is already cancelled");
        });

        // released driver comes from the row as cancelled, so an accept that landed first is still told
        List<String> recipients = new ArrayList<>();
        if (byRider && cancelled.getReleasedDriverId() != null) {
            recipients.add(cancelled.getReleasedDriverId());
        } else if (!byRider) {
            recipients.add(cancelled.getRiderId());
        }
        orderNotifier.notify(new OrderNotification(cancelled, previous, actorId, reason, recipients, null));
        return toResponse(cancelled, actorUserId);
    }

    private void cancelBySystem(UUID orderId, String reason) {
        Optional<DispatchOrder> cancelled = applyCancel(orderId, SYSTEM_ACTOR, reason);
        if (cancelled.isEmpty()) {
            log.debug("Order {} ended before the system cancel landed", orderId);
            return;
        }
        DispatchOrder order = cancelled.get();

        List<String> recipients = new ArrayList<>();
        recipients.add(order.getRiderId());
        if (order.getReleasedDriverId() != null) {
            recipients.add(order.getReleasedDriverId());
        }
        orderNotifier.notify(new OrderNotification(order, OrderStatus.PENDING, SYSTEM_ACTOR, reason, recipients, null));
    }

    /**
     * Conditional cancel: only an order that is still active is cancelled, whatever its
     * version. Returns the order as cancelled, or empty when it had already ended.
     */
    private Optional<DispatchOrder> applyCancel(UUID orderId, String actorId, String reason) {
        if (orderRepository.cancelIfActive(orderId, actorId, reason, Instant.now()) == 0) {
            return Optional.empty();
        }
        DispatchOrder cancelled = requireOrder(orderId);

        recordEvent(orderId, OrderEventType.CANCELLED, OrderStatus.CANCELLED, actorId, null, null, reason);
        log.info("Order {} cancelled by {} ({})", orderId, actorId, reason);
        return Optional.of(cancelled);
    }

    // ---------------------------------------------------------------- reads

    public OrderResponse getOrder(UUID orderId, String viewerUserId) {
        DispatchOrder order = requireOrder(orderId);
        if (!order.getRiderId().equals(viewerUserId) && !isAssignedDriver(order, viewerUserId)) {
            throw new DispatchException(ErrorCode.FORBIDDEN, "Order " + orderId + " belongs to another user");
        }
        return toResponse(order, viewerUserId);
    }

    public Optional<OrderResponse> getActiveOrderAsRider(String userId) {
        return orderRepository.findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(userId, OrderStatus.ACTIVE)
                .map(order -> toResponse(order, userId));
    }

    public Optional<OrderResponse> getActiveOrderAsDriver(String userId) {
        Driver driver = driverRepository.findByUserId(userId)
                .orElseThrow(() -> DispatchException.driverNotFound(userId));
        return orderRepository.findFirstByDriverIdAndStatusInOrderByAcceptedAtDesc(driver.getId(), OrderStatus.ACTIVE_WITH_DRIVER)
                .map(order -> toResponse(order, userId));
    }

    public List<OrderResponse> getHistory(String userId, int page, int size) {
        String driverId = driverRepository.findByUserId(userId).map(Driver::getId).orElse(null);
        return orderRepository.findHistory(userId, driverId, PageRequest.of(page, size)).stream()
                .map(order -> toResponse(order, userId))
                .toList();
    }

    /** True when the user is the rider or the assigned driver of the order. */
    public boolean isParticipant(UUID orderId, String identity) {
        return orderRepository.findById(orderId)
                .map(order -> order.getRiderId().equals(identity) || identity.equals(order.getDriverId()))
                .orElse(false);
    }

    // ---------------------------------------------------------------- helpers

    private OrderResponse replay(DispatchOrder existing, String riderId, String idempotencyKey) {
        if (!existing.getRiderId().equals(riderId)) {
            throw new DispatchException(ErrorCode.VALIDATION_ERROR,
                    "Idempotency-Key " + idempotencyKey + " was already used by another rider");
        }
        log.info("Idempotent replay for key {}", idempotencyKey);
        metrics.recordIdempotentReplay();
        return toResponse(existing, riderId);
    }

    private VehicleClass resolveVehicleClass(OrderType type, String code) {
        return VehicleClass.resolve(type, code)
                .orElseThrow(() -> new DispatchException(ErrorCode.UNKNOWN_VEHICLE_CLASS,
                        "Unknown vehicle class '" + code + "' for " + type + " orders"));
    }

    private DispatchOrder requireOrder(UUID orderId) {
        return orderRepository.findById(orderId).orElseThrow(() -> DispatchException.orderNotFound(orderId));
    }

    private Driver requireDriver(String driverId) {
        return driverRepository.findById(driverId).orElseThrow(() -> DispatchException.driverNotFound(driverId));
    }

    private boolean isAssignedDriver(DispatchOrder order, String userId) {
        return order.getDriverId() != null && driverRepository.findByUserId(userId)
                .map(d -> d.getId().equals(order.getDriverId()))
                .orElse(false);
    }

    private static DispatchException noLongerAvailable(UUID orderId) {
        return new DispatchException(ErrorCode.ORDER_NO_LONGER_AVAILABLE,
                "Order " + orderId + " was just taken by another driver or is no longer searching");
    }

    private Instant nextSearchExpiry(Instant now) {
        return now.plus(properties.getSearch().getOfferTimeout()).truncatedTo(ChronoUnit.MILLIS);
    }

    static String generateOtp() {
        return String.valueOf(1000 + OTP_RANDOM.nextInt(9000));
    }

    // audit rows are best effort; a failed insert must not undo a committed transition
    private void recordEvent(UUID orderId, OrderEventType type, OrderStatus status, String actorId,
                             Double lat, Double lng, String details) {
        try {
            orderEventRepository.save(OrderEvent.builder()
                    .orderId(orderId)
                    .eventType(type)
                    .status(status)
                    .actorId(actorId)
                    .latitude(lat)
                    .longitude(lng)
                    .details(details)
                    .build());
        } catch (DataAccessException e) {
            log.warn("Could not record {} event for order {}: {}", type, orderId, e.getMessage());
        }
    }

    private Map<String, Object> offerPayload(DispatchOrder order, DriverCandidate candidate, Instant expiresAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getId());
        payload.put("type", order.getType());
        payload.put("vehicleClass", order.getVehicleClass());
        payload.put("pickup", point(order.getPickupLat(), order.getPickupLng(), order.getPickupAddress()));
        payload.put("dropoff", point(order.getDropoffLat(), order.getDropoffLng(), order.getDropoffAddress()));
        payload.put("distanceKm", order.getDistanceKm());
        payload.put("durationMinutes", order.getDurationMinutes());
        payload.put("fare", order.getEstimatedFare());
        payload.put("distanceToPickupKm", Math.round(candidate.getDistanceKm() * 100.0) / 100.0);
        payload.put("etaMinutes", candidate.getEtaMinutes());
        payload.put("notes", order.getNotes());
        payload.put("expiresAt", expiresAt);
        return payload;
    }

    private static Map<String, Object> searchingPayload(DispatchOrder order, Instant expiresAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getId());
        payload.put("status", OrderStatus.PENDING);
        payload.put("searching", true);
        payload.put("noDriversAvailable", true);
        payload.put("nextAttemptAt", expiresAt);
        return payload;
    }

    private static Map<String, Object> point(double lat, double lng, String address) {
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("latitude", lat);
        point.put("longitude", lng);
        point.put("address", address);
        return point;
    }

    private DriverSummary toDriverSummary(Driver driver, DispatchOrder order) {
        Integer eta = null;
        if (driver.hasPosition() && order.getStatus() != OrderStatus.IN_PROGRESS
                && order.getStatus() != OrderStatus.COMPLETED) {
            eta = GeoUtils.etaMinutes(driver.getCurrentLat(), driver.getCurrentLng(),
                    order.getPickupLat(), order.getPickupLng());
        }
        return DriverSummary.builder()
                .id(driver.getId())
                .displayName(driver.getDisplayName())
                .vehicleType(driver.getVehicleType())
                .vehiclePlate(driver.getVehiclePlate())
                .vehicleModel(driver.getVehicleModel())
                .vehicleColor(driver.getVehicleColor())
                .rating(driver.getRating())
                .latitude(driver.getCurrentLat())
                .longitude(driver.getCurrentLng())
                .etaMinutes(eta)
                .build();
    }

    OrderResponse toResponse(DispatchOrder order, String viewerUserId) {
        DriverSummary driver = order.getDriverId() == null ? null
                : driverRepository.findById(order.getDriverId()).map(d -> toDriverSummary(d, order)).orElse(null);
        return OrderResponse.builder()
                .id(order.getId())
                .type(order.getType())
                .status(order.getStatus())
                .riderId(order.getRiderId())
                .driverId(order.getDriverId())
                .driver(driver)
                .vehicleClass(order.getVehicleClass())
                .pickupLat(order.getPickupLat())
                .pickupLng(order.getPickupLng())
                .pickupAddress(order.getPickupAddress())
                .dropoffLat(order.getDropoffLat())
                .dropoffLng(order.getDropoffLng())
                .dropoffAddress(order.getDropoffAddress())
                .notes(order.getNotes())
                .distanceKm(order.getDistanceKm())
                .durationMinutes(order.getDurationMinutes())
                .estimatedFare(order.getEstimatedFare())
                .surgeMultiplier(order.getSurgeMultiplier())
                .finalFare(order.getFinalFare())
                .otp(order.getRiderId().equals(viewerUserId) ? order.getOtp() : null)
                .broadcastCount(order.getBroadcastCount())
                .searchExpiresAt(order.getSearchExpiresAt())
                .cancelledBy(order.getCancelledBy())
                .cancellationReason(order.getCancellationReason())
                .createdAt(order.getCreatedAt())
                .acceptedAt(order.getAcceptedAt())
                .arrivedAt(order.getArrivedAt())
                .startedAt(order.getStartedAt())
                .completedAt(order.getCompletedAt())
                .cancelledAt(order.getCancelledAt())
                .build();
    }
}
