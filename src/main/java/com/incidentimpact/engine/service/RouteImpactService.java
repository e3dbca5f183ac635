package com.incidentimpact.engine.service;

import com.incidentimpact.engine.dto.DecodeResult;
import com.incidentimpact.engine.dto.RouteRequest;
import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.exception.RequestValidationException;
import com.incidentimpact.engine.model.AffectingEvent;
import com.incidentimpact.engine.model.BoundingBox;
import com.incidentimpact.engine.model.CandidateEvent;
import com.incidentimpact.engine.model.DecodedRoute;
import com.incidentimpact.engine.model.EtaValidation;
import com.incidentimpact.engine.model.IntersectionResult;
import com.incidentimpact.engine.model.LatLon;
import com.incidentimpact.engine.model.PolylineFormat;
import com.incidentimpact.engine.model.RouteEvaluation;
import com.incidentimpact.engine.model.RouteIntersection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a batch of routes through decode, intersect and ETA validation.
 *
 * Pipeline:
 * 1. Decode every polyline; a malformed one marks only its own route DECODE_ERROR
 * 2. Query the event store once for the union bounding box of all decoded routes
 * 3. Prepare the candidate geometries once and share them across routes
 * 4. Intersect and validate each route on the bounded worker pool
 *
 * One deadline, started when the request arrives, covers steps 2 to 4. Routes that miss
 * it come back TIMED_OUT next to the completed ones; a route whose evaluation throws
 * comes back FAILED. Neither aborts the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RouteImpactService {

    private final PolylineCodec polylineCodec;
    private final EventStoreGateway eventStoreGateway;
    private final IntersectionEngine intersectionEngine;
    private final EtaValidator etaValidator;
    private final ExecutorService routeEvaluationExecutor;
    private final Clock clock;

    @Value("${incident-impact.batch.timeout-ms:5000}")
    private long defaultTimeoutMs = 5000;

    @Value("${incident-impact.query.lookahead-minutes:360}")
    private long lookaheadMinutes = 360;

    @Value("${incident-impact.query.route-margin-degrees:0.01}")
    private double routeMarginDegrees = 0.01;

    /**
     * Parses a {@code type} filter: one source type or a comma-separated list,
     * case-insensitive. Blank means every type.
     *
     * @throws RequestValidationException on an unknown type
     */
    public static Set<EventSourceType> parseTypeFilter(String type) {
        if (type == null || type.isBlank()) {
            return EnumSet.allOf(EventSourceType.class);
        }
        Set<EventSourceType> types = EnumSet.noneOf(EventSourceType.class);
        for (String part : type.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                types.add(EventSourceType.fromValue(part.trim()));
            } catch (IllegalArgumentException e) {
                throw new RequestValidationException(e.getMessage());
            }
        }
        return types.isEmpty() ? EnumSet.allOf(EventSourceType.class) : types;
    }

    /**
     * Evaluates every route and returns one result per route, in request order.
     *
     * @param departureTime departure for routes that do not carry their own, {@code null} for now
     * @param timeoutMs     batch deadline, {@code null} for the configured default
     */
    public List<RouteEvaluation> evaluate(List<RouteRequest> routes, Set<EventSourceType> types,
                                          Instant departureTime, Long timeoutMs) {
        long startNanos = System.nanoTime();
        Instant now = clock.instant();
        Instant defaultDeparture = departureTime != null ? departureTime : now;
        long deadlineMs = timeoutMs != null ? timeoutMs : defaultTimeoutMs;

        Map<String, RouteEvaluation> results = new LinkedHashMap<>();
        List<DecodedRoute> decoded = new ArrayList<>();
        for (RouteRequest request : routes) {
            if (results.containsKey(request.id())) {
                throw new RequestValidationException("Duplicate route id: " + request.id());
            }
            PolylineFormat format = parseFormat(request);
            DecodeResult decodeResult = polylineCodec.decode(request.polyline(), format);
            if (!decodeResult.isSuccess()) {
                results.put(request.id(), RouteEvaluation.decodeError(request.id(), decodeResult.warning()));
                continue;
            }
            Instant departure = request.departureTime() != null ? request.departureTime() : defaultDeparture;
            decoded.add(new DecodedRoute(request.id(), decodeResult.coordinates(), departure,
                request.averageSpeedKph(), request.vertexOffsetsSeconds(), false));
            results.put(request.id(), null);
        }

        if (decoded.isEmpty()) {
            return new ArrayList<>(results.values());
        }

        Optional<List<CandidateEvent>> fetched =
            fetchCandidatesWithin(decoded, types, remainingMs(startNanos, deadlineMs));
        if (fetched.isEmpty()) {
            log.warn("Event store query did not finish within {} ms, reporting {} routes as timed out",
                deadlineMs, decoded.size());
            decoded.forEach(route -> results.put(route.id(), RouteEvaluation.timedOut(route.id())));
            return new ArrayList<>(results.values());
        }
        List<CandidateEvent> candidates = fetched.get();
        runBatch(decoded, candidates, remainingMs(startNanos, deadlineMs), results);

        long affected = results.values().stream().filter(r -> !r.events().isEmpty()).count();
        log.info("Evaluated {} routes against {} candidate events: {} affected", routes.size(),
            candidates.size(), affected);
        return new ArrayList<>(results.values());
    }

    /**
     * Runs the candidate query on the worker pool so the request deadline bounds it.
     * Empty when the deadline passes first; store failures propagate unchanged.
     */
    private Optional<List<CandidateEvent>> fetchCandidatesWithin(List<DecodedRoute> routes,
                                                                 Set<EventSourceType> types, long deadlineMs) {
        Future<List<CandidateEvent>> future = routeEvaluationExecutor.submit(() -> fetchCandidates(routes, types));
        try {
            return Optional.of(future.get(deadlineMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Candidate query failed", e.getCause());
        }
    }

    /**
     * The single event-store query of the request. The window starts at the earliest
     * departure and reaches the lookahead past the latest one.
     */
    private List<CandidateEvent> fetchCandidates(List<DecodedRoute> routes, Set<EventSourceType> types) {
        List<LatLon> allCoordinates = new ArrayList<>();
        Instant earliest = null;
        Instant latest = null;
        for (DecodedRoute route : routes) {
            if (route.isEmpty()) {
                continue;
            }
            allCoordinates.addAll(route.coordinates());
            earliest = earliest == null || route.departureTime().isBefore(earliest) ? route.departureTime() : earliest;
            latest = latest == null || route.departureTime().isAfter(latest) ? route.departureTime() : latest;
        }
        BoundingBox box = BoundingBox.covering(allCoordinates);
        if (box == null) {
            return List.of();
        }

        Duration window = Duration.between(earliest, latest).plusMinutes(lookaheadMinutes);
        List<IncidentEvent> events = eventStoreGateway.queryByBoundingBox(box.expand(routeMarginDegrees), earliest, window);
        List<IncidentEvent> filtered = events.stream()
            .filter(e -> types.contains(e.getSourceType()))
            .toList();
        log.debug("Candidate set: {} events in {}, {} after type filter", events.size(), box, filtered.size());
        return intersectionEngine.prepare(filtered);
    }

    private void runBatch(List<DecodedRoute> routes, List<CandidateEvent> candidates, long deadlineMs,
                          Map<String, RouteEvaluation> results) {
        List<Callable<RouteEvaluation>> tasks = routes.stream()
            .<Callable<RouteEvaluation>>map(route -> () -> evaluateRoute(route, candidates))
            .toList();

        List<Future<RouteEvaluation>> futures;
        try {
            futures = routeEvaluationExecutor.invokeAll(tasks, deadlineMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Route batch interrupted, reporting {} routes as timed out", routes.size());
            routes.forEach(route -> results.put(route.id(), RouteEvaluation.timedOut(route.id())));
            return;
        }

        for (int i = 0; i < routes.size(); i++) {
            DecodedRoute route = routes.get(i);
            results.put(route.id(), collect(route, futures.get(i), deadlineMs));
        }
    }

    private RouteEvaluation collect(DecodedRoute route, Future<RouteEvaluation> future, long deadlineMs) {
        if (future.isCancelled()) {
            log.warn("Route {} did not finish within {} ms", route.id(), deadlineMs);
            return RouteEvaluation.timedOut(route.id());
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            log.warn("Route {} did not finish within {} ms", route.id(), deadlineMs);
            return RouteEvaluation.timedOut(route.id());
        } catch (ExecutionException e) {
            log.error("Route {} evaluation failed", route.id(), e.getCause());
            return RouteEvaluation.failed(route.id(), "Route evaluation failed: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RouteEvaluation.timedOut(route.id());
        }
    }

    /**
     * Intersect and validate one route. Affecting events come back ordered by ETA.
     */
    RouteEvaluation evaluateRoute(DecodedRoute route, List<CandidateEvent> candidates) {
        IntersectionResult intersections = intersectionEngine.intersect(route, candidates);
        List<AffectingEvent> affecting = new ArrayList<>();
        for (RouteIntersection intersection : intersections.intersections()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Route " + route.id() + " cancelled");
            }
            EtaValidation validation = etaValidator.validate(route, intersection);
            if (validation.affecting()) {
                affecting.add(new AffectingEvent(intersection.event(), validation.eta(), validation.range()));
            } else {
                log.debug("Route {} intersects {} but is not affected: {}", route.id(),
                    intersection.event().toLogString(), validation.outcome());
            }
        }
        affecting.sort(Comparator.comparing(AffectingEvent::eta));
        return RouteEvaluation.ok(route, intersections, affecting);
    }

    private static long remainingMs(long startNanos, long deadlineMs) {
        return Math.max(0, deadlineMs - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private static PolylineFormat parseFormat(RouteRequest request) {
        try {
            return PolylineFormat.fromValue(request.format());
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException("Route " + request.id() + ": " + e.getMessage());
        }
    }
}
