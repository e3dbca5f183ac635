package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.List;

/**
 * One route of a batch evaluation request.
 *
 * @param id                   caller-supplied route id, echoed in the result
 * @param polyline             encoded route geometry
 * @param format               {@code google} (default) or {@code here}
 * @param departureTime        optional per-route departure, overrides the request-level one
 * @param averageSpeedKph      optional assumed speed for ETA estimation
 * @param vertexOffsetsSeconds optional elapsed seconds at each vertex, one entry per vertex
 */
public record RouteRequest(
    @NotBlank(message = "Route id cannot be blank")
    String id,

    @NotBlank(message = "Route polyline cannot be blank")
    String polyline,

    String format,

    @JsonProperty("departure_time")
    Instant departureTime,

    @Positive(message = "Average speed must be > 0")
    @JsonProperty("average_speed_kph")
    Double averageSpeedKph,

    @JsonProperty("vertex_offsets_seconds")
    List<@NotNull(message = "Vertex offsets cannot contain null") Double> vertexOffsetsSeconds
) {

    public static RouteRequest of(String id, String polyline) {
        return new RouteRequest(id, polyline, null, null, null, null);
    }
}
