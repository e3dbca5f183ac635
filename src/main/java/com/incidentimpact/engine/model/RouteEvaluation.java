package com.incidentimpact.engine.model;

import java.util.List;

/**
 * Per-route outcome of a batch evaluation. Failed or timed-out routes carry no events
 * and never abort their siblings.
 */
public record RouteEvaluation(
    String routeId,
    RouteStatus status,
    boolean truncated,
    int vertexCount,
    List<AffectingEvent> events,
    String message
) {

    public RouteEvaluation {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public enum RouteStatus {
        OK,
        DECODE_ERROR,
        TIMED_OUT,
        FAILED
    }

    public static RouteEvaluation ok(DecodedRoute route, IntersectionResult intersections, List<AffectingEvent> events) {
        String message = intersections.truncated()
            ? "Route truncated to " + intersections.evaluatedVertices() + " vertices"
            : null;
        return new RouteEvaluation(route.id(), RouteStatus.OK, intersections.truncated(),
            intersections.evaluatedVertices(), events, message);
    }

    public static RouteEvaluation decodeError(String routeId, String error) {
        return new RouteEvaluation(routeId, RouteStatus.DECODE_ERROR, false, 0, List.of(), error);
    }

    public static RouteEvaluation timedOut(String routeId) {
        return new RouteEvaluation(routeId, RouteStatus.TIMED_OUT, false, 0, List.of(),
            "Route evaluation exceeded the request deadline");
    }

    public static RouteEvaluation failed(String routeId, String error) {
        return new RouteEvaluation(routeId, RouteStatus.FAILED, false, 0, List.of(), error);
    }
}
