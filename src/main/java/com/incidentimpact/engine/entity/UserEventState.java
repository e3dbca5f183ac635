package com.incidentimpact.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Delivery and read state of one event for one user.
 *
 * Created the first time an event is confirmed as affecting the user, flipped to read
 * on acknowledgment and removed once the event expires. The unique constraint on
 * (user_id, event_id) backs the insert-if-absent upsert.
 */
@Entity
@Table(
    name = "user_event_states",
    uniqueConstraints = @UniqueConstraint(name = "uk_user_event", columnNames = {"user_id", "event_id"}),
    indexes = @Index(name = "idx_user_event_unread", columnList = "user_id, is_read")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserEventState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "delivered_at", nullable = false)
    private Instant deliveredAt;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private Instant readAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @JoinColumn(name = "event_id", insertable = false, updatable = false)
    private IncidentEvent event;
}
