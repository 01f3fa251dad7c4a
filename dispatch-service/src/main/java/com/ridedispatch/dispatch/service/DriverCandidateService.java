package com.ridedispatch.dispatch.service;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.geo.GeoIndex;
import com.ridedispatch.dispatch.model.DriverCandidate;
import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.dispatch.repository.OrderRepository;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import com.ridedispatch.shared.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the ranked candidate set for an order: drivers near the pickup that are
 * online, accept the order type, drive a vehicle suitable for the class and are
 * not already busy with another order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverCandidateService {

    // growth of the GeoIndex fetch between scan rounds
    private static final int SCAN_FACTOR = 4;

    private final GeoIndex geoIndex;
    private final DriverRepository driverRepository;
    private final OrderRepository orderRepository;
    private final DispatchProperties properties;

    public List<DriverCandidate> findCandidates(double pickupLat, double pickupLng,
                                                OrderType type, VehicleClass vehicleClass,
                                                Collection<String> excludeDriverIds, int limit) {
        return findCandidates(pickupLat, pickupLng, properties.getSearch().getRadiusKm(),
                type, vehicleClass, excludeDriverIds, limit);
    }

    /**
     * Scans nearby drivers nearest first, widening the scan until {@code limit} eligible
     * drivers are found, the radius holds nobody further, or {@code candidate-scan-limit}
     * drivers were inspected.
     *
     * @param type         order type drivers must accept, or null for any
     * @param vehicleClass class the vehicle must serve, or null for any
     */
    public List<DriverCandidate> findCandidates(double pickupLat, double pickupLng, double radiusKm,
                                                OrderType type, VehicleClass vehicleClass,
                                                Collection<String> excludeDriverIds, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<String> excluded = excludeDriverIds == null ? Set.of() : new HashSet<>(excludeDriverIds);
        int scanLimit = Math.max(properties.getSearch().getCandidateScanLimit(), limit + excluded.size());
        int fetch = Math.min(scanLimit, Math.max(limit * SCAN_FACTOR, limit + excluded.size()));

        List<DriverCandidate> candidates;
        int nearbyCount;
        while (true) {
            List<String> nearbyIds = geoIndex.query(pickupLat, pickupLng, radiusKm, fetch);
            nearbyCount = nearbyIds.size();
            candidates = eligible(nearbyIds, excluded, pickupLat, pickupLng, radiusKm, type, vehicleClass);
            if (candidates.size() >= limit || nearbyCount < fetch || fetch >= scanLimit) {
                break;
            }
            fetch = Math.min(scanLimit, fetch * SCAN_FACTOR);
        }

        List<DriverCandidate> ranked = candidates.stream().limit(limit).toList();
        log.debug("Candidate search at ({}, {}) r={}km: {} nearby, {} excluded, {} eligible",
                pickupLat, pickupLng, radiusKm, nearbyCount, excluded.size(), ranked.size());
        return ranked;
    }

    private List<DriverCandidate> eligible(List<String> nearbyIds, Set<String> excluded,
                                           double pickupLat, double pickupLng, double radiusKm,
                                           OrderType type, VehicleClass vehicleClass) {
        List<String> ids = nearbyIds.stream().filter(id -> !excluded.contains(id)).toList();
        if (ids.isEmpty()) {
            return List.of();
        }

        Map<String, Driver> drivers = driverRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Driver::getId, Function.identity()));
        Set<String> busy = new HashSet<>(orderRepository.findBusyDriverIds(ids, OrderStatus.ACTIVE_WITH_DRIVER));

        return ids.stream()
                .map(drivers::get)
                .filter(d -> d != null && d.isOnline() && !busy.contains(d.getId()))
                .filter(d -> type == null || d.getAvailabilityType().accepts(type))
                .filter(d -> vehicleClass == null || vehicleClass.isServedBy(d.getVehicleType()))
                .map(d -> toCandidate(d, pickupLat, pickupLng))
                .filter(c -> c.getDistanceKm() <= radiusKm)
                .sorted(Comparator.comparingDouble(DriverCandidate::getDistanceKm))
                .toList();
    }

    private DriverCandidate toCandidate(Driver driver, double pickupLat, double pickupLng) {
        double distanceKm;
        int etaMinutes;
        if (driver.hasPosition()) {
            distanceKm = GeoUtils.haversineKm(driver.getCurrentLat(), driver.getCurrentLng(), pickupLat, pickupLng);
            etaMinutes = GeoUtils.etaMinutes(driver.getCurrentLat(), driver.getCurrentLng(), pickupLat, pickupLng);
        } else {
            distanceKm = geoIndex.distanceTo(driver.getId(), pickupLat, pickupLng).orElse(Double.MAX_VALUE);
            etaMinutes = (int) Math.ceil(distanceKm * GeoUtils.ROAD_DISTANCE_FACTOR / GeoUtils.AVERAGE_URBAN_SPEED_KMH * 60.0);
        }
        return DriverCandidate.builder()
                .driverId(driver.getId())
                .distanceKm(distanceKm)
                .etaMinutes(etaMinutes)
                .vehicleType(driver.getVehicleType())
                .rating(driver.getRating())
                .build();
    }
}
