package com.incidentimpact.engine.model;

import java.time.Instant;
import java.util.List;

/**
 * A caller-supplied route after polyline decoding. Never persisted.
 *
 * @param id                   caller-supplied route id
 * @param coordinates          ordered route vertices
 * @param departureTime        when the traveller leaves the first vertex
 * @param averageSpeedKph      optional speed override, {@code null} uses the configured default
 * @param vertexOffsetsSeconds optional per-vertex elapsed seconds from departure,
 *                             only used when it has one entry per vertex
 * @param truncated            whether the vertex list was cut to the configured limit
 */
public record DecodedRoute(
    String id,
    List<LatLon> coordinates,
    Instant departureTime,
    Double averageSpeedKph,
    List<Double> vertexOffsetsSeconds,
    boolean truncated
) {

    public DecodedRoute {
        coordinates = List.copyOf(coordinates);
        vertexOffsetsSeconds = vertexOffsetsSeconds == null ? null : List.copyOf(vertexOffsetsSeconds);
    }

    public int vertexCount() {
        return coordinates.size();
    }

    public boolean isEmpty() {
        return coordinates.isEmpty();
    }

    public boolean hasVertexTiming() {
        return vertexOffsetsSeconds != null && vertexOffsetsSeconds.size() == coordinates.size();
    }

    /**
     * Returns a copy keeping only the first {@code maxVertices} vertices.
     */
    public DecodedRoute truncateTo(int maxVertices) {
        if (coordinates.size() <= maxVertices) {
            return this;
        }
        List<Double> offsets = hasVertexTiming() ? vertexOffsetsSeconds.subList(0, maxVertices) : null;
        return new DecodedRoute(id, coordinates.subList(0, maxVertices), departureTime,
            averageSpeedKph, offsets, true);
    }
}
