package com.incidentimpact.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.Map;

/**
 * A normalized hazard event, whatever provider it came from.
 *
 * The fields the engine reasons about (geometry, validity window, version, direction)
 * are typed columns. Provider-specific extras live in {@link #rawMetadata}.
 *
 * The geometry is a Polygon or MultiPolygon in SRID 4326; point-sourced events are
 * buffered into a polygon at ingestion. A GiST index on the column backs the
 * bounding-box query.
 */
@Entity
@Table(name = "incident_events", indexes = {
    @Index(name = "idx_event_version", columnList = "version"),
    @Index(name = "idx_event_expires_at", columnList = "expires_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncidentEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Stable identifier assigned by the upstream provider. Re-ingestion updates the
     * row carrying the same value.
     */
    @Column(name = "external_id", nullable = false, unique = true, length = 255)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 32)
    private EventSourceType sourceType;

    @Column(name = "geometry", columnDefinition = "geometry(Geometry,4326)", nullable = false)
    private Geometry geometry;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(length = 50)
    private String severity;

    @Column(length = 50)
    private String certainty;

    @Column(length = 50)
    private String urgency;

    @Column(length = 500)
    private String headline;

    @Column(length = 4000)
    private String description;

    /**
     * Optional travel direction the event applies to, e.g. "northbound".
     */
    @Column(length = 50)
    private String directionality;

    /**
     * Monotonic version, reassigned on every upsert. Drives incremental sync.
     */
    @Column(nullable = false)
    private long version;

    @Column(name = "reroute_hint", nullable = false)
    private boolean rerouteHint;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_metadata", columnDefinition = "jsonb")
    private Map<String, Object> rawMetadata;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Whether the validity window overlaps {@code [from, to]}.
     */
    public boolean overlapsWindow(Instant from, Instant to) {
        return !startTime.isAfter(to) && !expiresAt.isBefore(from);
    }

    public boolean isExpiredAt(Instant instant) {
        return instant.isAfter(expiresAt);
    }

    public String toLogString() {
        return String.format("IncidentEvent[id=%d, externalId=%s, type=%s, version=%d]",
            id, externalId, sourceType, version);
    }
}
