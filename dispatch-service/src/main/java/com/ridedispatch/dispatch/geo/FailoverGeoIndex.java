package com.ridedispatch.dispatch.geo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * GeoIndex used by the rest of the service: the Redis tier first, the drivers table
 * when Redis fails (through the tier's fallback) or has nobody in range.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailoverGeoIndex implements GeoIndex {

    private final RedisGeoIndex primary;
    private final DurableGeoIndex durable;

    @Override
    public void upsert(String driverId, double lat, double lng, Double heading) {
        await(primary.upsert(driverId, lat, lng, heading), null, "upsert");
    }

    @Override
    public void refresh(String driverId, double lat, double lng, Double heading) {
        await(primary.refresh(driverId, lat, lng, heading), null, "refresh");
    }

    @Override
    public void remove(String driverId) {
        await(primary.remove(driverId), null, "remove");
    }

    @Override
    public List<String> query(double lat, double lng, double radiusKm, int limit) {
        List<String> ids = await(primary.query(lat, lng, radiusKm, limit), List.of(), "query");
        if (!ids.isEmpty()) {
            return ids;
        }
        // the cache may have missed drivers that came online on another instance
        return durable.query(lat, lng, radiusKm, limit);
    }

    @Override
    public OptionalDouble distanceTo(String driverId, double lat, double lng) {
        OptionalDouble cached = await(primary.distanceTo(driverId, lat, lng), OptionalDouble.empty(), "distanceTo");
        return cached.isPresent() ? cached : durable.distanceTo(driverId, lat, lng);
    }

    private static <T> T await(CompletableFuture<T> future, T orElse, String operation) {
        try {
            T value = future.join();
            return value != null ? value : orElse;
        } catch (CompletionException | CancellationException e) {
            log.warn("GeoIndex {} failed: {}", operation, e.getMessage());
            return orElse;
        }
    }
}
