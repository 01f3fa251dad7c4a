package com.ridedispatch.shared.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Spherical-earth geometry used by every component that compares distances.
 * Estimation, candidate filtering and ranking all go through {@link #haversineKm}.
 */
public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_PER_DEGREE_LAT = 111.0;

    /** Straight-line to road distance correction. */
    public static final double ROAD_DISTANCE_FACTOR = 1.4;
    public static final double AVERAGE_URBAN_SPEED_KMH = 30.0;

    private GeoUtils() {}

    public static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double haversineMeters(double lat1, double lng1, double lat2, double lng2) {
        return haversineKm(lat1, lng1, lat2, lng2) * 1000.0;
    }

    /**
     * Coarse pre-filter for radius queries against a store that only supports range predicates.
     * Always contains the exact circle; callers must still filter with {@link #haversineKm}.
     */
    public static BoundingBox boundingBox(double lat, double lng, double radiusKm) {
        double latDelta = radiusKm / KM_PER_DEGREE_LAT;
        double cosLat = Math.cos(Math.toRadians(lat));
        double lngDelta = cosLat < 1e-6 ? 180.0 : radiusKm / (KM_PER_DEGREE_LAT * cosLat);
        return new BoundingBox(lat - latDelta, lat + latDelta, lng - lngDelta, lng + lngDelta);
    }

    /**
     * Road distance approximation (rounded to 0.1 km) and driving time in whole minutes.
     */
    public static RouteEstimate estimateRoute(double fromLat, double fromLng, double toLat, double toLng) {
        double roadKm = haversineKm(fromLat, fromLng, toLat, toLng) * ROAD_DISTANCE_FACTOR;
        double rounded = BigDecimal.valueOf(roadKm).setScale(1, RoundingMode.HALF_UP).doubleValue();
        int minutes = (int) Math.ceil(roadKm / AVERAGE_URBAN_SPEED_KMH * 60.0);
        return new RouteEstimate(rounded, minutes);
    }

    /** Minutes for a driver at the given position to reach a point. */
    public static int etaMinutes(double fromLat, double fromLng, double toLat, double toLng) {
        return estimateRoute(fromLat, fromLng, toLat, toLng).durationMinutes();
    }

    public record BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {}

    public record RouteEstimate(double distanceKm, int durationMinutes) {}
}
