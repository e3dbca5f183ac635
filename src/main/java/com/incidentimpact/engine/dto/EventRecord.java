package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.util.GeoJsonHelper;

import java.time.Instant;
import java.util.Map;

/**
 * Outward representation of an incident event, geometry rendered as GeoJSON.
 */
public record EventRecord(
    Long id,
    @JsonProperty("external_id") String externalId,
    @JsonProperty("source_type") EventSourceType sourceType,
    Map<String, Object> geometry,
    Instant start,
    Instant expires,
    String severity,
    String certainty,
    String urgency,
    String headline,
    String description,
    String directionality,
    long version,
    @JsonProperty("reroute_hint") boolean rerouteHint,
    Map<String, Object> metadata
) {

    public static EventRecord fromEntity(IncidentEvent event) {
        return new EventRecord(
            event.getId(),
            event.getExternalId(),
            event.getSourceType(),
            GeoJsonHelper.toGeoJson(event.getGeometry()),
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
}
