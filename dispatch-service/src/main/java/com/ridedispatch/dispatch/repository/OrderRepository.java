package com.ridedispatch.dispatch.repository;

import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.shared.enums.OrderStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<DispatchOrder, UUID> {

    Optional<DispatchOrder> findByIdempotencyKey(String idempotencyKey);

    Optional<DispatchOrder> findFirstByRiderIdAndStatusInOrderByCreatedAtDesc(String riderId, Collection<OrderStatus> statuses);

    Optional<DispatchOrder> findFirstByDriverIdAndStatusInOrderByAcceptedAtDesc(String driverId, Collection<OrderStatus> statuses);

    boolean existsByDriverIdAndStatusIn(String driverId, Collection<OrderStatus> statuses);

    @Query("SELECT o FROM DispatchOrder o WHERE o.riderId = :userId OR o.driverId = :driverId " +
            "OR o.releasedDriverId = :driverId ORDER BY o.createdAt DESC")
    Page<DispatchOrder> findHistory(@Param("userId") String userId,
                                    @Param("driverId") String driverId,
                                    Pageable pageable);

    @Query("SELECT o.driverId FROM DispatchOrder o WHERE o.driverId IN :driverIds AND o.status IN :statuses")
    List<String> findBusyDriverIds(@Param("driverIds") Collection<String> driverIds,
                                   @Param("statuses") Collection<OrderStatus> statuses);

    /**
     * Atomic accept: assigns the driver only while the order is still PENDING and the
     * driver holds no other active order. Returns 1 for the single winner, 0 for everyone else.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DispatchOrder o SET o.status = :assigned, o.driverId = :driverId, o.acceptedAt = :now, " +
            "o.searchExpiresAt = null, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :pending " +
            "AND NOT EXISTS (SELECT x.id FROM DispatchOrder x WHERE x.driverId = :driverId AND x.status IN :active)")
    int compareAndAssign(@Param("id") UUID id,
                         @Param("driverId") String driverId,
                         @Param("now") Instant now,
                         @Param("pending") OrderStatus pending,
                         @Param("assigned") OrderStatus assigned,
                         @Param("active") Collection<OrderStatus> active);

    default int assignDriverIfPending(UUID id, String driverId, Instant now) {
        return compareAndAssign(id, driverId, now, OrderStatus.PENDING, OrderStatus.DRIVER_ASSIGNED,
                OrderStatus.ACTIVE_WITH_DRIVER);
    }

    /**
     * Cancels the order only while it is still active. The assigned driver, if any, moves
     * to releasedDriverId in the same statement. Returns 0 when the order already ended.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DispatchOrder o SET o.status = :cancelled, o.releasedDriverId = o.driverId, o.driverId = null, " +
            "o.cancelledAt = :now, o.cancelledBy = :actor, o.cancellationReason = :reason, " +
            "o.searchExpiresAt = null, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status IN :active")
    int cancelIfActive(@Param("id") UUID id,
                       @Param("actor") String actor,
                       @Param("reason") String reason,
                       @Param("now") Instant now,
                       @Param("cancelled") OrderStatus cancelled,
                       @Param("active") Collection<OrderStatus> active);

    default int cancelIfActive(UUID id, String actor, String reason, Instant now) {
        return cancelIfActive(id, actor, reason, now, OrderStatus.CANCELLED, OrderStatus.ACTIVE);
    }

    /**
     * Starts a new accept window after a broadcast. No-op once the order left PENDING.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DispatchOrder o SET o.searchExpiresAt = :expiresAt, o.broadcastCount = o.broadcastCount + 1, " +
            "o.version = o.version + 1 WHERE o.id = :id AND o.status = :pending")
    int renewSearch(@Param("id") UUID id,
                    @Param("expiresAt") Instant expiresAt,
                    @Param("pending") OrderStatus pending);

    default int renewSearch(UUID id, Instant expiresAt) {
        return renewSearch(id, expiresAt, OrderStatus.PENDING);
    }

    /**
     * Claims an expired accept window for one sweeper. The lease value read by the
     * sweeper must still be in place, so concurrent sweepers cannot both claim it.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DispatchOrder o SET o.searchExpiresAt = :next, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :pending AND o.searchExpiresAt = :seen")
    int claimExpiredSearch(@Param("id") UUID id,
                           @Param("seen") Instant seen,
                           @Param("next") Instant next,
                           @Param("pending") OrderStatus pending);

    default int claimExpiredSearch(UUID id, Instant seen, Instant next) {
        return claimExpiredSearch(id, seen, next, OrderStatus.PENDING);
    }

    @Query("SELECT o FROM DispatchOrder o WHERE o.status = :pending AND o.searchExpiresAt <= :now " +
            "ORDER BY o.searchExpiresAt ASC")
    List<DispatchOrder> findExpiredSearches(@Param("now") Instant now,
                                            @Param("pending") OrderStatus pending,
                                            Pageable pageable);

    default List<DispatchOrder> findExpiredSearches(Instant now, Pageable pageable) {
        return findExpiredSearches(now, OrderStatus.PENDING, pageable);
    }
}
