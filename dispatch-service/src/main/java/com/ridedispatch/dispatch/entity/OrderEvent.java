package com.ridedispatch.dispatch.entity;

import com.ridedispatch.shared.enums.OrderStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit trail of an order's lifecycle.
 */
@Entity
@Table(name = "order_events", indexes = @Index(name = "idx_order_events_order", columnList = "order_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class OrderEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 24)
    private OrderEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(length = 24)
    private OrderStatus status;

    @Column(name = "actor_id")
    private String actorId;

    private Double latitude;

    private Double longitude;

    @Column(length = 500)
    private String details;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public enum OrderEventType {
        CREATED,
        BROADCAST,
        DECLINED,
        TIMEOUT,
        STATUS_CHANGED,
        CANCELLED
    }
}
