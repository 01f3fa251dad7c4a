package com.ridedispatch.dispatch.entity;

import com.ridedispatch.shared.enums.AvailabilityType;
import com.ridedispatch.shared.enums.VehicleType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Driver profile plus the durable copy of the driver's last accepted position.
 * Profiles are registered elsewhere; this service only toggles availability and location.
 */
@Entity
@Table(name = "drivers",
        indexes = {
                @Index(name = "idx_drivers_user", columnList = "user_id", unique = true),
                @Index(name = "idx_drivers_online_position", columnList = "is_online, current_lat, current_lng")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Driver {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false, unique = true)
    private String userId;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "is_online", nullable = false)
    private boolean online;

    @Enumerated(EnumType.STRING)
    @Column(name = "availability_type", nullable = false, length = 16)
    @Builder.Default
    private AvailabilityType availabilityType = AvailabilityType.BOTH;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_type", nullable = false, length = 16)
    private VehicleType vehicleType;

    @Column(name = "vehicle_plate")
    private String vehiclePlate;

    @Column(name = "vehicle_model")
    private String vehicleModel;

    @Column(name = "vehicle_color")
    private String vehicleColor;

    @Builder.Default
    private double rating = 5.0;

    @Column(name = "total_rides")
    private int totalRides;

    @Column(name = "total_deliveries")
    private int totalDeliveries;

    @Column(name = "current_lat")
    private Double currentLat;

    @Column(name = "current_lng")
    private Double currentLng;

    @Column(name = "heading")
    private Double heading;

    @Column(name = "last_location_update")
    private Instant lastLocationUpdate;

    public boolean hasPosition() {
        return currentLat != null && currentLng != null;
    }
}
