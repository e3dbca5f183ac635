package com.incidentimpact.engine.dto;

import jakarta.validation.constraints.NotNull;

/**
 * @param polyline encoded polyline string
 * @param format   {@code google} (default) or {@code here}
 */
public record PolylineRequest(
    @NotNull(message = "polyline is required")
    String polyline,

    String format
) {
}
