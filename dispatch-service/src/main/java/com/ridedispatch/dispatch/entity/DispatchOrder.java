package com.ridedispatch.dispatch.entity;

import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "orders",
        indexes = {
                @Index(name = "idx_orders_rider", columnList = "rider_id"),
                @Index(name = "idx_orders_driver", columnList = "driver_id"),
                @Index(name = "idx_orders_status_search", columnList = "status, search_expires_at"),
                @Index(name = "idx_orders_idempotency", columnList = "idempotency_key", unique = true)
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class DispatchOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Incremented by every update, including the bulk compare-and-set queries in
     * OrderRepository, so a stale entity save after an accept fails instead of overwriting it.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private OrderStatus status;

    @Column(name = "rider_id", nullable = false)
    private String riderId;

    @Column(name = "driver_id")
    private String driverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_class", nullable = false, length = 16)
    private VehicleClass vehicleClass;

    @Column(name = "pickup_lat", nullable = false)
    private double pickupLat;

    @Column(name = "pickup_lng", nullable = false)
    private double pickupLng;

    @Column(name = "pickup_address")
    private String pickupAddress;

    @Column(name = "dropoff_lat", nullable = false)
    private double dropoffLat;

    @Column(name = "dropoff_lng", nullable = false)
    private double dropoffLng;

    @Column(name = "dropoff_address")
    private String dropoffAddress;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "distance_km")
    private double distanceKm;

    @Column(name = "duration_minutes")
    private int durationMinutes;

    @Column(name = "estimated_fare", precision = 10, scale = 2)
    private BigDecimal estimatedFare;

    @Column(name = "surge_multiplier")
    private double surgeMultiplier;

    @Column(name = "final_fare", precision = 10, scale = 2)
    private BigDecimal finalFare;

    @Column(name = "otp", nullable = false, length = 4)
    private String otp;

    /** Accept-timer lease: when a PENDING order's offers expire and the sweep rebroadcasts it. */
    @Column(name = "search_expires_at")
    private Instant searchExpiresAt;

    @Column(name = "broadcast_count")
    private int broadcastCount;

    @Column(name = "idempotency_key", unique = true)
    private String idempotencyKey;

    @Column(name = "cancelled_by")
    private String cancelledBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    /** Driver that was assigned when the order got cancelled. */
    @Column(name = "released_driver_id")
    private String releasedDriverId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "arrived_at")
    private Instant arrivedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
