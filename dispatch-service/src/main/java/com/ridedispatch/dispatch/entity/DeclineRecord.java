package com.ridedispatch.dispatch.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A driver that declined an order while it was searching. Rebroadcasts never
 * offer the order to drivers recorded here.
 */
@Entity
@Table(name = "order_declines",
        uniqueConstraints = @UniqueConstraint(name = "uk_decline_order_driver", columnNames = {"order_id", "driver_id"}),
        indexes = @Index(name = "idx_decline_order", columnList = "order_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class DeclineRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @CreationTimestamp
    @Column(name = "declined_at", updatable = false)
    private Instant declinedAt;
}
