package com.incidentimpact.engine.model;

import java.util.List;

/**
 * Intersections found for one route, plus whether the route had to be truncated first.
 */
public record IntersectionResult(List<RouteIntersection> intersections, boolean truncated, int evaluatedVertices) {

    public IntersectionResult {
        intersections = List.copyOf(intersections);
    }
}
