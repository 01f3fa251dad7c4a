package com.ridedispatch.dispatch.geo;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.shared.util.GeoUtils;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;

/**
 * Cache tier of the GeoIndex on a Redis GEO sorted set.
 *
 * Key layout:
 *   drivers:geo              GEO set of online drivers (member = driverId)
 *   driver:location:{id}     hash {lat, lng, heading, updatedAt} with a 5 minute TTL
 *
 * A GEO member has no TTL of its own, so the position hash acts as its lease: members
 * whose hash expired are skipped by queries and removed from the set on the way.
 *
 * Every call runs in the {@code geo-index} thread-pool bulkhead under a time limit
 * ({@code geo-write}, {@code geo-query}) and the {@code geo-index} circuit breaker.
 * Failed or rejected writes are dropped; failed reads are answered by the drivers table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisGeoIndex {

    private static final String BREAKER = "geo-index";

    // Redis measures on a slightly larger sphere than ours; over-fetch, then filter with the shared formula
    private static final double RADIUS_PADDING = 1.01;

    private final StringRedisTemplate redisTemplate;
    private final DurableGeoIndex durableIndex;
    private final DispatchProperties properties;

    @Bulkhead(name = BREAKER, type = Bulkhead.Type.THREADPOOL)
    @TimeLimiter(name = "geo-write")
    @CircuitBreaker(name = BREAKER, fallbackMethod = "skipWrite")
    public CompletableFuture<Void> upsert(String driverId, double lat, double lng, Double heading) {
        write(driverId, lat, lng, heading);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Extends the lease of a driver that reported without moving. When the lease
     * already lapsed, the given last known position is indexed again.
     */
    @Bulkhead(name = BREAKER, type = Bulkhead.Type.THREADPOOL)
    @TimeLimiter(name = "geo-write")
    @CircuitBreaker(name = BREAKER, fallbackMethod = "skipWrite")
    public CompletableFuture<Void> refresh(String driverId, double lat, double lng, Double heading) {
        Boolean extended = redisTemplate.expire(positionKey(driverId), geo().getEntryTtl());
        if (!Boolean.TRUE.equals(extended)) {
            log.debug("Lease of driver {} had lapsed, re-indexing last known position", driverId);
            write(driverId, lat, lng, heading);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Bulkhead(name = BREAKER, type = Bulkhead.Type.THREADPOOL)
    @TimeLimiter(name = "geo-write")
    @CircuitBreaker(name = BREAKER, fallbackMethod = "skipWrite")
    public CompletableFuture<Void> remove(String driverId) {
        redisTemplate.opsForGeo().remove(geo().getKey(), driverId);
        redisTemplate.delete(positionKey(driverId));
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Driver ids within {@code radiusKm}, nearest first, at most {@code limit}.
     */
    @Bulkhead(name = BREAKER, type = Bulkhead.Type.THREADPOOL)
    @TimeLimiter(name = "geo-query")
    @CircuitBreaker(name = BREAKER, fallbackMethod = "queryDurable")
    public CompletableFuture<List<String>> query(double lat, double lng, double radiusKm, int limit) {
        if (limit <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.completedFuture(radiusQuery(lat, lng, radiusKm, limit));
    }

    @Bulkhead(name = BREAKER, type = Bulkhead.Type.THREADPOOL)
    @TimeLimiter(name = "geo-query")
    @CircuitBreaker(name = BREAKER, fallbackMethod = "distanceDurable")
    public CompletableFuture<OptionalDouble> distanceTo(String driverId, double lat, double lng) {
        Object storedLat = redisTemplate.opsForHash().get(positionKey(driverId), "lat");
        Object storedLng = redisTemplate.opsForHash().get(positionKey(driverId), "lng");
        if (storedLat == null || storedLng == null) {
            return CompletableFuture.completedFuture(OptionalDouble.empty());
        }
        double distanceKm = GeoUtils.haversineKm(
                Double.parseDouble(storedLat.toString()), Double.parseDouble(storedLng.toString()), lat, lng);
        return CompletableFuture.completedFuture(OptionalDouble.of(distanceKm));
    }

    // ---------------------------------------------------------------- fallbacks

    public CompletableFuture<Void> skipWrite(String driverId, double lat, double lng, Double heading, Throwable e) {
        logFailure("position write for driver " + driverId, e);
        return CompletableFuture.completedFuture(null);
    }

    public CompletableFuture<Void> skipWrite(String driverId, Throwable e) {
        logFailure("removal of driver " + driverId, e);
        return CompletableFuture.completedFuture(null);
    }

    public CompletableFuture<List<String>> queryDurable(double lat, double lng, double radiusKm, int limit, Throwable e) {
        logFailure("radius query", e);
        return CompletableFuture.completedFuture(durableIndex.query(lat, lng, radiusKm, limit));
    }

    public CompletableFuture<OptionalDouble> distanceDurable(String driverId, double lat, double lng, Throwable e) {
        logFailure("position lookup for driver " + driverId, e);
        return CompletableFuture.completedFuture(durableIndex.distanceTo(driverId, lat, lng));
    }

    // ---------------------------------------------------------------- redis

    private void write(String driverId, double lat, double lng, Double heading) {
        redisTemplate.opsForGeo().add(geo().getKey(), new Point(lng, lat), driverId);

        Map<String, String> position = new HashMap<>();
        position.put("lat", String.valueOf(lat));
        position.put("lng", String.valueOf(lng));
        position.put("updatedAt", Instant.now().toString());
        if (heading != null) {
            position.put("heading", String.valueOf(heading));
        }
        String positionKey = positionKey(driverId);
        redisTemplate.opsForHash().putAll(positionKey, position);
        redisTemplate.expire(positionKey, geo().getEntryTtl());
    }

    private List<String> radiusQuery(double lat, double lng, double radiusKm, int limit) {
        Circle circle = new Circle(new Point(lng, lat), new Distance(radiusKm * RADIUS_PADDING, Metrics.KILOMETERS));
        GeoResults<RedisGeoCommands.GeoLocation<String>> results = redisTemplate.opsForGeo().radius(
                geo().getKey(),
                circle,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                        .includeCoordinates()
                        .sortAscending()
                        .limit(limit * 2L));
        if (results == null) {
            return List.of();
        }

        List<Hit> hits = new ArrayList<>();
        List<String> expired = new ArrayList<>();
        for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : results) {
            RedisGeoCommands.GeoLocation<String> location = result.getContent();
            Point point = location.getPoint();
            if (point == null) {
                continue;
            }
            double distanceKm = GeoUtils.haversineKm(lat, lng, point.getY(), point.getX());
            if (distanceKm > radiusKm) {
                continue;
            }
            if (!Boolean.TRUE.equals(redisTemplate.hasKey(positionKey(location.getName())))) {
                expired.add(location.getName());
                continue;
            }
            hits.add(new Hit(location.getName(), distanceKm));
        }

        if (!expired.isEmpty()) {
            redisTemplate.opsForGeo().remove(geo().getKey(), expired.toArray(new String[0]));
            log.debug("Evicted {} expired driver positions from {}", expired.size(), geo().getKey());
        }

        return hits.stream()
                .sorted(Comparator.comparingDouble(Hit::distanceKm))
                .limit(limit)
                .map(Hit::driverId)
                .toList();
    }

    private void logFailure(String operation, Throwable e) {
        if (e instanceof CallNotPermittedException) {
            log.debug("GeoIndex circuit open, skipping Redis for {}", operation);
        } else {
            log.warn("GeoIndex {} failed on Redis ({}: {})", operation, e.getClass().getSimpleName(), e.getMessage());
        }
    }

    private DispatchProperties.Geo geo() {
        return properties.getGeo();
    }

    private String positionKey(String driverId) {
        return geo().getPositionKeyPrefix() + driverId;
    }

    private record Hit(String driverId, double distanceKm) {}
}
