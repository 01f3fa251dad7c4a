package com.ridedispatch.dispatch.geo;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Radius-queryable index of online drivers' last known positions.
 *
 * Implementations never throw: a failed write is logged and dropped, a failed
 * query answers with an empty list.
 */
public interface GeoIndex {

    void upsert(String driverId, double lat, double lng, Double heading);

    /**
     * Keeps a stationary driver indexed: extends the position's lease without moving it,
     * or re-indexes the given position if the lease already lapsed.
     */
    void refresh(String driverId, double lat, double lng, Double heading);

    void remove(String driverId);

    /**
     * Driver ids within {@code radiusKm} of the point, nearest first, at most {@code limit}.
     */
    List<String> query(double lat, double lng, double radiusKm, int limit);

    OptionalDouble distanceTo(String driverId, double lat, double lng);
}
