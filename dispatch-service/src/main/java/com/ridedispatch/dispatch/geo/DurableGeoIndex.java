package com.ridedispatch.dispatch.geo;

import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.metrics.DispatchMetrics;
import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.shared.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Radius lookups against the drivers table, used whenever the Redis tier cannot answer.
 *
 * Filters a bounding box in SQL, then keeps only drivers whose great-circle distance
 * is within the radius. Every query counts as a {@code geo.index.fallback}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DurableGeoIndex {

    private final DriverRepository driverRepository;
    private final DispatchMetrics metrics;

    public List<String> query(double lat, double lng, double radiusKm, int limit) {
        metrics.recordGeoFallback();
        GeoUtils.BoundingBox box = GeoUtils.boundingBox(lat, lng, radiusKm);
        try {
            return driverRepository.findOnlineWithin(box.minLat(), box.maxLat(), box.minLng(), box.maxLng())
                    .stream()
                    .filter(Driver::hasPosition)
                    .map(d -> new Ranked(d.getId(), GeoUtils.haversineKm(lat, lng, d.getCurrentLat(), d.getCurrentLng())))
                    .filter(r -> r.distanceKm() <= radiusKm)
                    .sorted(Comparator.comparingDouble(Ranked::distanceKm))
                    .limit(limit)
                    .map(Ranked::driverId)
                    .toList();
        } catch (DataAccessException e) {
            log.warn("Durable radius query failed at ({}, {}): {}", lat, lng, e.getMessage());
            return List.of();
        }
    }

    public OptionalDouble distanceTo(String driverId, double lat, double lng) {
        try {
            return driverRepository.findById(driverId)
                    .filter(Driver::hasPosition)
                    .map(d -> OptionalDouble.of(GeoUtils.haversineKm(d.getCurrentLat(), d.getCurrentLng(), lat, lng)))
                    .orElse(OptionalDouble.empty());
        } catch (DataAccessException e) {
            log.warn("Durable position lookup failed for driver {}: {}", driverId, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private record Ranked(String driverId, double distanceKm) {}
}
