package com.incidentimpact.engine.service;

import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.model.DecodedRoute;
import com.incidentimpact.engine.model.EtaValidation;
import com.incidentimpact.engine.model.LatLon;
import com.incidentimpact.engine.model.RouteIntersection;
import com.incidentimpact.engine.model.SegmentRange;
import com.incidentimpact.engine.model.TravelDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a geometric intersection actually affects the trip.
 *
 * The traveller reaches the middle of the intersecting range at
 * {@code eta = departure + elapsed}, where elapsed comes from per-vertex timing when the
 * route carries it and from distance over average speed otherwise. The event affects
 * the trip only if {@code start <= eta <= expires} and, for directional events, the
 * route bearing across the range is within the configured tolerance of the event
 * direction.
 *
 * Fails closed: a computation error makes the intersection non-affecting and is logged.
 */
@Component
@Slf4j
public class EtaValidator {

    @Value("${incident-impact.eta.default-speed-kph:60}")
    private double defaultSpeedKph = 60.0;

    @Value("${incident-impact.eta.direction-tolerance-degrees:45}")
    private double directionToleranceDegrees = 45.0;

    public EtaValidator() {
    }

    EtaValidator(double defaultSpeedKph, double directionToleranceDegrees) {
        this.defaultSpeedKph = defaultSpeedKph;
        this.directionToleranceDegrees = directionToleranceDegrees;
    }

    /**
     * Validates every range of the intersection in route order and returns the first
     * affecting one, or the verdict for the first range when none affects the trip.
     */
    public EtaValidation validate(DecodedRoute route, RouteIntersection intersection) {
        EtaValidation first = null;
        for (SegmentRange range : intersection.ranges()) {
            EtaValidation validation = validate(route, intersection.event(), range, route.departureTime());
            if (validation.affecting()) {
                return validation;
            }
            if (first == null) {
                first = validation;
            }
        }
        return first;
    }

    /**
     * Single-range check against an explicit departure time.
     */
    public EtaValidation validate(DecodedRoute route, IncidentEvent event, SegmentRange range, Instant departureTime) {
        try {
            Instant eta = departureTime.plus(elapsedTo(route, range));

            if (eta.isBefore(event.getStartTime())) {
                return EtaValidation.rejected(eta, range, EtaValidation.Outcome.NOT_YET_ACTIVE);
            }
            if (eta.isAfter(event.getExpiresAt())) {
                return EtaValidation.rejected(eta, range, EtaValidation.Outcome.EXPIRED);
            }

            Optional<TravelDirection> direction = directionOf(event);
            if (direction.isPresent()) {
                double bearing = bearingAcross(route.coordinates(), range);
                double difference = GeoMath.angularDifference(bearing, direction.get().bearingDegrees());
                if (difference > directionToleranceDegrees) {
                    log.debug("Route {} bearing {} vs {} {} exceeds tolerance", route.id(),
                        Math.round(bearing), direction.get(), event.toLogString());
                    return EtaValidation.rejected(eta, range, EtaValidation.Outcome.DIRECTION_MISMATCH);
                }
            }
            return EtaValidation.affecting(eta, range);

        } catch (RuntimeException e) {
            log.error("ETA validation failed for route {} and {}; treating as not affecting",
                route.id(), event.toLogString(), e);
            return EtaValidation.failed(range);
        }
    }

    /**
     * Elapsed travel time from departure to the midpoint of {@code range}.
     */
    Duration elapsedTo(DecodedRoute route, SegmentRange range) {
        List<LatLon> coordinates = route.coordinates();
        if (range.endIndex() >= coordinates.size()) {
            throw new IllegalArgumentException("Range " + range + " is outside the route");
        }

        if (route.hasVertexTiming()) {
            double startOffset = route.vertexOffsetsSeconds().get(range.startIndex());
            double endOffset = route.vertexOffsetsSeconds().get(range.endIndex());
            if (!Double.isFinite(startOffset) || !Double.isFinite(endOffset) || startOffset < 0 || endOffset < startOffset) {
                throw new IllegalArgumentException("Route " + route.id() + " carries invalid vertex timing");
            }
            return secondsToDuration((startOffset + endOffset) / 2.0d);
        }

        double toRangeStart = 0.0d;
        double rangeLength = 0.0d;
        for (int i = 0; i < range.endIndex(); i++) {
            double segment = GeoMath.distanceMeters(coordinates.get(i), coordinates.get(i + 1));
            if (i < range.startIndex()) {
                toRangeStart += segment;
            } else {
                rangeLength += segment;
            }
        }
        double routeLength = toRangeStart + rangeLength;
        for (int i = range.endIndex(); i < coordinates.size() - 1; i++) {
            routeLength += GeoMath.distanceMeters(coordinates.get(i), coordinates.get(i + 1));
        }
        if (routeLength <= 0.0d) {
            throw new IllegalStateException("Route " + route.id() + " has zero length");
        }

        double speedKph = route.averageSpeedKph() != null ? route.averageSpeedKph() : defaultSpeedKph;
        if (!(speedKph > 0.0d)) {
            throw new IllegalArgumentException("Average speed must be positive: " + speedKph);
        }
        double metersPerSecond = speedKph / 3.6d;
        return secondsToDuration((toRangeStart + rangeLength / 2.0d) / metersPerSecond);
    }

    /**
     * Bearing from the first to the last vertex of the range, falling back to the first
     * non-degenerate segment when the range closes on itself.
     */
    double bearingAcross(List<LatLon> coordinates, SegmentRange range) {
        LatLon from = coordinates.get(range.startIndex());
        LatLon to = coordinates.get(range.endIndex());
        if (GeoMath.distanceMeters(from, to) > 0.0d) {
            return GeoMath.initialBearingDegrees(from, to);
        }
        for (int i = range.startIndex(); i < range.endIndex(); i++) {
            LatLon a = coordinates.get(i);
            LatLon b = coordinates.get(i + 1);
            if (GeoMath.distanceMeters(a, b) > 0.0d) {
                return GeoMath.initialBearingDegrees(a, b);
            }
        }
        throw new IllegalStateException("Degenerate segment range " + range + ": no direction of travel");
    }

    private Optional<TravelDirection> directionOf(IncidentEvent event) {
        try {
            return TravelDirection.parse(event.getDirectionality());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unrecognized directionality '{}' on {}", event.getDirectionality(), event.toLogString());
            return Optional.empty();
        }
    }

    private static Duration secondsToDuration(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000.0d));
    }
}
