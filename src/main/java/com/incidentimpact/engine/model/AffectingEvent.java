package com.incidentimpact.engine.model;

import com.incidentimpact.engine.entity.IncidentEvent;

import java.time.Instant;

/**
 * An event confirmed as affecting a route: it intersects the route geometry, is active
 * at the estimated arrival time and matches the direction of travel.
 */
public record AffectingEvent(IncidentEvent event, Instant eta, SegmentRange range) {
}
