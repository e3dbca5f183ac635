package com.incidentimpact.engine.dto;

import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.util.GeoJsonHelper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Redis representation of an active event. Geometry travels as WKT and is re-parsed
 * into a detached {@link IncidentEvent} when read back.
 */
public record CachedEventRecord(
    Long id,
    String externalId,
    EventSourceType sourceType,
    String wkt,
    Instant startTime,
    Instant expiresAt,
    String severity,
    String certainty,
    String urgency,
    String headline,
    String description,
    String directionality,
    long version,
    boolean rerouteHint,
    Map<String, Object> rawMetadata
) {

    public static CachedEventRecord fromEntity(IncidentEvent event) {
        return new CachedEventRecord(
            event.getId(),
            event.getExternalId(),
            event.getSourceType(),
            new WKTWriter().write(event.getGeometry()),
            event.getStartTime(),
            event.getExpiresAt(),
            event.getSeverity(),
            event.getCertainty(),
            event.getUrgency(),
            event.getHeadline(),
            event.getDescription(),
            event.getDirectionality(),
            event.getVersion(),
            event.isRerouteHint(),
            event.getRawMetadata()
        );
    }

    public IncidentEvent toEntity() throws ParseException {
        Geometry geometry = new WKTReader(GeoJsonHelper.wgs84Factory()).read(wkt);
        geometry.setSRID(GeoJsonHelper.WGS84_SRID);
        return IncidentEvent.builder()
            .id(id)
            .externalId(externalId)
            .sourceType(sourceType)
            .geometry(geometry)
            .startTime(startTime)
            .expiresAt(expiresAt)
            .severity(severity)
            .certainty(certainty)
            .urgency(urgency)
            .headline(headline)
            .description(description)
            .directionality(directionality)
            .version(version)
            .rerouteHint(rerouteHint)
            .rawMetadata(rawMetadata)
            .build();
    }

    /**
     * All events active at or after {@code createdAt}, as of store version {@code version}.
     */
    public record Snapshot(long version, Instant createdAt, List<CachedEventRecord> events) {
    }
}
