package com.incidentimpact.engine.service;

import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.model.CandidateEvent;
import com.incidentimpact.engine.model.DecodedRoute;
import com.incidentimpact.engine.model.IntersectionResult;
import com.incidentimpact.engine.model.LatLon;
import com.incidentimpact.engine.model.RouteIntersection;
import com.incidentimpact.engine.model.SegmentRange;
import com.incidentimpact.engine.util.GeoJsonHelper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tests a route against event polygons segment by segment.
 *
 * Each route segment becomes a two-point JTS LineString; a segment touches an event when
 * its envelope overlaps the event envelope and the prepared event geometry intersects
 * it. That covers both a segment crossing the polygon boundary and a segment lying
 * wholly inside. Marked segments are folded into contiguous vertex ranges.
 *
 * Cost is O(segments x candidates) envelope checks plus prepared-geometry tests on the
 * overlaps, bounded by the configured vertex limit. Pure function of its inputs.
 */
@Component
@Slf4j
public class IntersectionEngine {

    private final GeometryFactory geometryFactory = GeoJsonHelper.wgs84Factory();

    @Value("${incident-impact.route.max-vertices:5000}")
    private int maxVertices = 5000;

    public IntersectionEngine() {
    }

    IntersectionEngine(int maxVertices) {
        this.maxVertices = maxVertices;
    }

    /**
     * Prepares a candidate set once so it can be shared by every route of a request.
     */
    public List<CandidateEvent> prepare(List<IncidentEvent> events) {
        List<CandidateEvent> candidates = new ArrayList<>(events.size());
        for (IncidentEvent event : events) {
            if (event.getGeometry() == null || event.getGeometry().isEmpty()) {
                log.warn("Skipping event without geometry: {}", event.toLogString());
                continue;
            }
            candidates.add(CandidateEvent.prepare(event));
        }
        return candidates;
    }

    /**
     * Prepares {@code events} and intersects a single route with them.
     */
    IntersectionResult intersectEvents(DecodedRoute route, List<IncidentEvent> events) {
        return intersect(route, prepare(events));
    }

    /**
     * Finds every candidate the route touches, with the vertex ranges involved.
     * Routes above the vertex limit are truncated and the result says so.
     */
    public IntersectionResult intersect(DecodedRoute route, List<CandidateEvent> candidates) {
        DecodedRoute evaluated = route.truncateTo(maxVertices);
        if (evaluated.truncated() && !route.truncated()) {
            log.warn("Route {} has {} vertices, truncated to {}", route.id(), route.vertexCount(), maxVertices);
        }
        if (evaluated.isEmpty() || candidates.isEmpty()) {
            return new IntersectionResult(List.of(), evaluated.truncated(), evaluated.vertexCount());
        }

        List<Geometry> segments = toSegments(evaluated.coordinates());
        List<Envelope> envelopes = segments.stream().map(Geometry::getEnvelopeInternal).toList();

        List<RouteIntersection> intersections = new ArrayList<>();
        for (CandidateEvent candidate : candidates) {
            List<SegmentRange> ranges = matchRanges(evaluated, segments, envelopes, candidate);
            if (!ranges.isEmpty()) {
                intersections.add(new RouteIntersection(route.id(), candidate.event(), ranges));
                log.debug("Route {} touches {} at {}", route.id(), candidate.event().toLogString(), ranges);
            }
        }
        return new IntersectionResult(intersections, evaluated.truncated(), evaluated.vertexCount());
    }

    /**
     * One geometry per segment; a single-vertex route yields a single point.
     */
    private List<Geometry> toSegments(List<LatLon> coordinates) {
        if (coordinates.size() == 1) {
            return List.of(geometryFactory.createPoint(coordinates.get(0).toCoordinate()));
        }
        List<Geometry> segments = new ArrayList<>(coordinates.size() - 1);
        for (int i = 0; i < coordinates.size() - 1; i++) {
            Coordinate from = coordinates.get(i).toCoordinate();
            Coordinate to = coordinates.get(i + 1).toCoordinate();
            segments.add(from.equals2D(to)
                ? geometryFactory.createPoint(from)
                : geometryFactory.createLineString(new Coordinate[]{from, to}));
        }
        return segments;
    }

    private List<SegmentRange> matchRanges(DecodedRoute route, List<Geometry> segments,
                                           List<Envelope> envelopes, CandidateEvent candidate) {
        if (route.vertexCount() == 1) {
            return candidate.prepared().intersects(segments.get(0))
                ? List.of(new SegmentRange(0, 0))
                : List.of();
        }

        List<SegmentRange> ranges = new ArrayList<>();
        int runStart = -1;
        for (int i = 0; i < segments.size(); i++) {
            boolean hit = envelopes.get(i).intersects(candidate.envelope())
                && candidate.prepared().intersects(segments.get(i));
            if (hit && runStart < 0) {
                runStart = i;
            } else if (!hit && runStart >= 0) {
                ranges.add(new SegmentRange(runStart, i));
                runStart = -1;
            }
        }
        if (runStart >= 0) {
            ranges.add(new SegmentRange(runStart, segments.size()));
        }
        return ranges;
    }
}
