package com.ridedispatch.dispatch.location;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.exception.DispatchException;
import com.ridedispatch.dispatch.exception.ErrorCode;
import com.ridedispatch.dispatch.geo.GeoIndex;
import com.ridedispatch.dispatch.messaging.EventPublisher;
import com.ridedispatch.dispatch.metrics.DispatchMetrics;
import com.ridedispatch.dispatch.model.AvailabilityRequest;
import com.ridedispatch.dispatch.model.DriverStatusResponse;
import com.ridedispatch.dispatch.model.LocationUpdateResult;
import com.ridedispatch.dispatch.realtime.Channels;
import com.ridedispatch.dispatch.realtime.RealtimeGateway;
import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.dispatch.repository.OrderRepository;
import com.ridedispatch.shared.enums.AvailabilityType;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.events.DriverLocationUpdatedEvent;
import com.ridedispatch.shared.featureflag.FeatureFlagService;
import com.ridedispatch.shared.util.GeoUtils;
import com.ridedispatch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ingests driver position reports.
 *
 * Flow for an accepted report:
 *  1. Durable driver row updated (source of truth for the fallback radius query)
 *  2. GeoIndex upsert (best effort)
 *  3. driver.location.updated republished on Kafka (best effort)
 *  4. If the driver is on an active order, position pushed to the order channel
 *
 * Reports closer than {@code dispatch.location.min-movement-meters} to the stored
 * position are suppressed: nothing is written or published, but the driver's lease
 * in the GeoIndex is extended so a stationary driver stays searchable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverLocationService {

    private final DriverRepository driverRepository;
    private final OrderRepository orderRepository;
    private final GeoIndex geoIndex;
    private final RealtimeGateway realtimeGateway;
    private final EventPublisher eventPublisher;
    private final FeatureFlagService featureFlagService;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    public Driver requireDriverByUserId(String userId) {
        return driverRepository.findByUserId(userId)
                .orElseThrow(() -> DispatchException.driverNotFound(userId));
    }

    public Driver requireDriver(String driverId) {
        return driverRepository.findById(driverId)
                .orElseThrow(() -> DispatchException.driverNotFound(driverId));
    }

    public LocationUpdateResult reportLocation(String driverId, double lat, double lng, Double heading) {
        Driver driver = requireDriver(driverId);
        if (!driver.isOnline()) {
            throw new DispatchException(ErrorCode.DRIVER_OFFLINE, "Driver " + driverId + " is offline");
        }

        Double movedMeters = null;
        if (driver.hasPosition()) {
            movedMeters = GeoUtils.haversineMeters(driver.getCurrentLat(), driver.getCurrentLng(), lat, lng);
            if (movedMeters < properties.getLocation().getMinMovementMeters()) {
                metrics.recordLocationSuppressed();
                geoIndex.refresh(driverId, driver.getCurrentLat(), driver.getCurrentLng(), driver.getHeading());
                log.debug("Suppressed location of {}: moved {}m", driverId, Math.round(movedMeters));
                return LocationUpdateResult.suppressed(movedMeters);
            }
        }

        Instant now = Instant.now();
        driverRepository.updateLocation(driverId, lat, lng, heading, now);
        geoIndex.upsert(driverId, lat, lng, heading);
        metrics.recordLocationAccepted();

        Optional<DispatchOrder> activeOrder = findActiveOrder(driverId);

        eventPublisher.publish(KafkaTopics.DRIVER_LOCATION_UPDATED, driverId, DriverLocationUpdatedEvent.builder()
                .driverId(driverId)
                .latitude(lat)
                .longitude(lng)
                .heading(heading)
                .movedMeters(movedMeters)
                .activeOrderId(activeOrder.map(o -> o.getId().toString()).orElse(null))
                .timestamp(now)
                .build());

        activeOrder.ifPresent(order -> streamToOrder(order, driverId, lat, lng, heading));

        log.debug("Location of {} updated to ({}, {})", driverId, lat, lng);
        return LocationUpdateResult.accepted(movedMeters);
    }

    /**
     * Going offline drops the driver from the fast index immediately; going online
     * with a known position puts it back without waiting for the next report.
     */
    public DriverStatusResponse updateAvailability(String driverId, AvailabilityRequest request) {
        Driver driver = requireDriver(driverId);
        boolean online = Boolean.TRUE.equals(request.getOnline());
        AvailabilityType availability = request.getAvailabilityType() != null
                ? request.getAvailabilityType()
                : driver.getAvailabilityType();

        driverRepository.updateAvailability(driverId, online, availability);
        driver.setOnline(online);
        driver.setAvailabilityType(availability);

        if (!online) {
            geoIndex.remove(driverId);
        } else if (driver.hasPosition()) {
            geoIndex.upsert(driverId, driver.getCurrentLat(), driver.getCurrentLng(), driver.getHeading());
        }
        log.info("Driver {} is now {} ({})", driverId, online ? "online" : "offline", availability);
        return toStatus(driver);
    }

    public DriverStatusResponse getStatus(String driverId) {
        return toStatus(requireDriver(driverId));
    }

    private Optional<DispatchOrder> findActiveOrder(String driverId) {
        try {
            return orderRepository.findFirstByDriverIdAndStatusInOrderByAcceptedAtDesc(
                    driverId, OrderStatus.ACTIVE_WITH_DRIVER);
        } catch (DataAccessException e) {
            log.warn("Active order lookup for {} failed: {}", driverId, e.getMessage());
            return Optional.empty();
        }
    }

    private void streamToOrder(DispatchOrder order, String driverId, double lat, double lng, Double heading) {
        if (!featureFlagService.isEnabled(FeatureFlagService.REAL_TIME_TRACKING, true)) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getId());
        payload.put("driverId", driverId);
        payload.put("latitude", lat);
        payload.put("longitude", lng);
        payload.put("heading", heading);
        payload.put("etaMinutes", GeoUtils.etaMinutes(lat, lng, targetLat(order), targetLng(order)));
        realtimeGateway.broadcast(Channels.order(order.getId()),
                RealtimeMessage.of(RealtimeMessage.DRIVER_LOCATION, payload));
    }

    // heading to pickup until the trip starts, then to dropoff
    private static double targetLat(DispatchOrder order) {
        return order.getStatus() == OrderStatus.IN_PROGRESS ? order.getDropoffLat() : order.getPickupLat();
    }

    private static double targetLng(DispatchOrder order) {
        return order.getStatus() == OrderStatus.IN_PROGRESS ? order.getDropoffLng() : order.getPickupLng();
    }

    private DriverStatusResponse toStatus(Driver driver) {
        return DriverStatusResponse.builder()
                .id(driver.getId())
                .online(driver.isOnline())
                .availabilityType(driver.getAvailabilityType())
                .vehicleType(driver.getVehicleType())
                .rating(driver.getRating())
                .totalRides(driver.getTotalRides())
                .totalDeliveries(driver.getTotalDeliveries())
                .latitude(driver.getCurrentLat())
                .longitude(driver.getCurrentLng())
                .lastLocationUpdate(driver.getLastLocationUpdate())
                .build();
    }
}
