package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.List;

/**
 * Batch evaluation request: which of these routes are affected by active events.
 *
 * @param routes        routes to evaluate
 * @param type          optional event type filter, one type or a comma-separated list
 * @param departureTime departure for routes that do not state their own; defaults to now
 * @param timeoutMs     optional deadline for the whole batch
 */
public record UserInformaticEventsRequest(
    @NotEmpty(message = "At least one route is required")
    List<@Valid RouteRequest> routes,

    String type,

    @JsonProperty("departure_time")
    Instant departureTime,

    @Positive(message = "timeout_ms must be > 0")
    @JsonProperty("timeout_ms")
    Long timeoutMs
) {
}
