package com.incidentimpact.engine.model;

import com.incidentimpact.engine.entity.IncidentEvent;

import java.util.List;

/**
 * Ephemeral result of the geometric test: which parts of a route touch an event.
 *
 * @param routeId route the ranges refer to
 * @param event   intersected event
 * @param ranges  contiguous vertex ranges in route order, never empty
 */
public record RouteIntersection(String routeId, IncidentEvent event, List<SegmentRange> ranges) {

    public RouteIntersection {
        if (ranges == null || ranges.isEmpty()) {
            throw new IllegalArgumentException("An intersection needs at least one segment range");
        }
        ranges = List.copyOf(ranges);
    }
}
