package com.ridedispatch.dispatch.repository;

import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.shared.enums.AvailabilityType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DriverRepository extends JpaRepository<Driver, String> {

    Optional<Driver> findByUserId(String userId);

    /** Row lock held until the surrounding transaction ends; serializes accepts of one driver. */
    @Transactional
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Driver d WHERE d.id = :id")
    Optional<Driver> lockById(@Param("id") String id);

    /** Bounding-box pre-filter; callers apply the exact great-circle distance. */
    @Query("SELECT d FROM Driver d WHERE d.online = true " +
            "AND d.currentLat BETWEEN :minLat AND :maxLat " +
            "AND d.currentLng BETWEEN :minLng AND :maxLng")
    List<Driver> findOnlineWithin(@Param("minLat") double minLat,
                                  @Param("maxLat") double maxLat,
                                  @Param("minLng") double minLng,
                                  @Param("maxLng") double maxLng);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.currentLat = :lat, d.currentLng = :lng, d.heading = :heading, " +
            "d.lastLocationUpdate = :at WHERE d.id = :id")
    int updateLocation(@Param("id") String id,
                       @Param("lat") double lat,
                       @Param("lng") double lng,
                       @Param("heading") Double heading,
                       @Param("at") Instant at);

    /** Touches only the availability columns so a concurrent location write is never overwritten. */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.online = :online, d.availabilityType = :availabilityType WHERE d.id = :id")
    int updateAvailability(@Param("id") String id,
                           @Param("online") boolean online,
                           @Param("availabilityType") AvailabilityType availabilityType);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.totalRides = d.totalRides + 1 WHERE d.id = :id")
    int incrementTotalRides(@Param("id") String id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.totalDeliveries = d.totalDeliveries + 1 WHERE d.id = :id")
    int incrementTotalDeliveries(@Param("id") String id);
}
