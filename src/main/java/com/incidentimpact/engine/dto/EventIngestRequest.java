package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Map;

/**
 * Provider payload handed to the ingestion boundary by the feed jobs.
 *
 * @param externalId     provider identifier; re-sending it updates the stored event
 * @param sourceType     Incident, DMS, Flood, Closure or WeatherAlert
 * @param geometry       GeoJSON Point, Polygon or MultiPolygon
 * @param start          start of validity
 * @param expires        end of validity, must not precede {@code start}
 * @param directionality optional affected travel direction
 * @param metadata       provider-specific fields kept verbatim
 */
public record EventIngestRequest(
    @NotBlank(message = "external_id is required")
    @JsonProperty("external_id")
    String externalId,

    @NotBlank(message = "source_type is required")
    @JsonProperty("source_type")
    String sourceType,

    @NotEmpty(message = "geometry is required")
    Map<String, Object> geometry,

    @NotNull(message = "start is required")
    Instant start,

    @NotNull(message = "expires is required")
    Instant expires,

    String severity,
    String certainty,
    String urgency,
    String headline,
    String description,
    String directionality,

    @JsonProperty("reroute_hint")
    Boolean rerouteHint,

    Map<String, Object> metadata
) {
}
