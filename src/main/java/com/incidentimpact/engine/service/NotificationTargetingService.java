package com.incidentimpact.engine.service;

import com.incidentimpact.engine.dto.AffectingEventRecord;
import com.incidentimpact.engine.dto.EventRecord;
import com.incidentimpact.engine.dto.IncidentEventsResponse;
import com.incidentimpact.engine.dto.PolledEventRecord;
import com.incidentimpact.engine.dto.RouteEvaluationResult;
import com.incidentimpact.engine.dto.UnreadEventsResponse;
import com.incidentimpact.engine.dto.UserInformaticEventsRequest;
import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.entity.UserEventState;
import com.incidentimpact.engine.exception.EventNotFoundException;
import com.incidentimpact.engine.exception.RequestValidationException;
import com.incidentimpact.engine.model.AffectingEvent;
import com.incidentimpact.engine.model.BoundingBox;
import com.incidentimpact.engine.model.LatLon;
import com.incidentimpact.engine.model.RouteEvaluation;
import com.incidentimpact.engine.repository.UserEventStateRepository;
import com.incidentimpact.engine.util.GeoJsonHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decides what each user is told about, and when.
 *
 * Per (event, user) pair the lifecycle is:
 * Unseen -> Evaluated -> Affecting -> Delivered (Unread) -> Read -> Expired.
 * The Delivered transition is the atomic insert of a {@link UserEventState} row; only
 * the call that creates the row hands the event to {@link NotificationDispatcher}, so
 * concurrent requests for the same user never deliver twice. Expired is implicit once
 * the event's window has passed, and the rows are purged on the user's next unread
 * query.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationTargetingService {

    private final RouteImpactService routeImpactService;
    private final EventStoreGateway eventStoreGateway;
    private final UserEventStateRepository stateRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    @Value("${incident-impact.query.point-radius-degrees:0.0005}")
    private double pointRadiusDegrees = 0.0005;

    /**
     * Per-route affecting events for a user. Each returned event is marked delivered for
     * the user; events already acknowledged come back with {@code read = true} and are
     * not delivered again.
     */
    public List<RouteEvaluationResult> affectingEvents(String userId, UserInformaticEventsRequest request) {
        requireUser(userId);
        Set<EventSourceType> types = RouteImpactService.parseTypeFilter(request.type());
        List<RouteEvaluation> evaluations = routeImpactService.evaluate(
            request.routes(), types, request.departureTime(), request.timeoutMs());

        Map<Long, AffectingEvent> firstSighting = new LinkedHashMap<>();
        for (RouteEvaluation evaluation : evaluations) {
            for (AffectingEvent affecting : evaluation.events()) {
                firstSighting.putIfAbsent(affecting.event().getId(), affecting);
            }
        }

        Instant now = clock.instant();
        int delivered = 0;
        for (AffectingEvent affecting : firstSighting.values()) {
            if (markDelivered(userId, affecting.event().getId(), now)) {
                notificationDispatcher.dispatch(userId, AffectingEventRecord.from(affecting, false));
                delivered++;
            }
        }

        Set<Long> readIds = firstSighting.isEmpty() ? Set.of() : stateRepository
            .findByUserIdAndEventIdIn(userId, firstSighting.keySet()).stream()
            .filter(UserEventState::isRead)
            .map(UserEventState::getEventId)
            .collect(Collectors.toSet());

        log.info("User {}: {} routes evaluated, {} affecting events, {} newly delivered",
            userId, evaluations.size(), firstSighting.size(), delivered);

        return evaluations.stream()
            .map(evaluation -> toResult(evaluation, readIds))
            .toList();
    }

    /**
     * Affecting events the user has not read yet.
     *
     * With a location, active events covering that point are first recorded as delivered
     * (first sighting). The answer is every unread, unexpired delivery, newest first.
     */
    public UnreadEventsResponse unreadEvents(String userId, Double lat, Double lon) {
        requireUser(userId);
        Instant now = clock.instant();

        int purged = stateRepository.deleteExpiredForUser(userId, now);
        if (purged > 0) {
            log.debug("Purged {} expired event states for user {}", purged, userId);
        }

        if (lat != null || lon != null) {
            deliverAtLocation(userId, toLocation(lat, lon), now);
        }

        List<UserEventState> unread = stateRepository.findByUserIdAndReadFalseOrderByDeliveredAtDesc(userId);
        Map<Long, IncidentEvent> events = eventStoreGateway
            .findNotExpired(unread.stream().map(UserEventState::getEventId).toList(), now).stream()
            .collect(Collectors.toMap(IncidentEvent::getId, Function.identity()));

        List<EventRecord> records = new ArrayList<>();
        for (UserEventState state : unread) {
            IncidentEvent event = events.get(state.getEventId());
            if (event != null) {
                records.add(EventRecord.fromEntity(event));
            }
        }
        log.info("User {} has {} unread events", userId, records.size());
        return UnreadEventsResponse.of(records);
    }

    /**
     * Marks an event read for a user. Acknowledging an event that was never delivered
     * records the delivery first.
     *
     * @return whether the state changed (false when it was already read)
     */
    public boolean acknowledge(String userId, Long eventId) {
        requireUser(userId);
        if (eventStoreGateway.findById(eventId).isEmpty()) {
            throw new EventNotFoundException(eventId);
        }
        Instant now = clock.instant();
        stateRepository.insertIfAbsent(userId, eventId, now);
        boolean changed = stateRepository.markRead(userId, eventId, now) > 0;
        log.info("User {} acknowledged event {}{}", userId, eventId, changed ? "" : " (already read)");
        return changed;
    }

    /**
     * Incremental sync for an area.
     *
     * Without a cursor (or cursor 0) this is a full sync: every event active now in the
     * box. With a cursor it returns every event changed since, each flagged with whether
     * it still applies to the box, so clients can drop events that moved away or
     * expired. The returned version is the cursor for the next poll.
     */
    public IncidentEventsResponse poll(Long sinceVersion, BoundingBox box) {
        Instant now = clock.instant();

        if (sinceVersion == null || sinceVersion <= 0) {
            // Read the version first so nothing written during the query is skipped next time.
            long version = eventStoreGateway.currentVersion();
            List<PolledEventRecord> events = eventStoreGateway.queryByBoundingBox(box, now).stream()
                .map(e -> new PolledEventRecord(EventRecord.fromEntity(e), true))
                .toList();
            log.info("Full sync of {}: {} events at version {}", box, events.size(), version);
            return new IncidentEventsResponse(events, version);
        }

        Geometry area = GeoJsonHelper.wgs84Factory().toGeometry(box.toEnvelope());
        long newVersion = sinceVersion;
        List<PolledEventRecord> events = new ArrayList<>();
        for (IncidentEvent event : eventStoreGateway.queryByVersion(sinceVersion)) {
            boolean affected = !event.isExpiredAt(now)
                && box.intersects(event.getGeometry().getEnvelopeInternal())
                && event.getGeometry().intersects(area);
            events.add(new PolledEventRecord(EventRecord.fromEntity(event), affected));
            newVersion = Math.max(newVersion, event.getVersion());
        }
        log.info("Incremental sync of {} since {}: {} changed events, new version {}",
            box, sinceVersion, events.size(), newVersion);
        return new IncidentEventsResponse(events, newVersion);
    }

    private void deliverAtLocation(String userId, LatLon location, Instant now) {
        Point point = GeoJsonHelper.wgs84Factory().createPoint(location.toCoordinate());
        List<IncidentEvent> nearby = eventStoreGateway.queryByBoundingBox(
            BoundingBox.around(location, pointRadiusDegrees), now);
        for (IncidentEvent event : nearby) {
            if (event.getGeometry().covers(point) && markDelivered(userId, event.getId(), now)) {
                notificationDispatcher.dispatch(userId, EventRecord.fromEntity(event));
            }
        }
    }

    private boolean markDelivered(String userId, Long eventId, Instant now) {
        return stateRepository.insertIfAbsent(userId, eventId, now) > 0;
    }

    private static RouteEvaluationResult toResult(RouteEvaluation evaluation, Set<Long> readIds) {
        List<AffectingEventRecord> events = evaluation.events().stream()
            .map(a -> AffectingEventRecord.from(a, readIds.contains(a.event().getId())))
            .toList();
        return new RouteEvaluationResult(evaluation.routeId(), evaluation.status(), evaluation.truncated(),
            evaluation.vertexCount(), events, evaluation.message());
    }

    private static LatLon toLocation(Double lat, Double lon) {
        if (lat == null || lon == null) {
            throw new RequestValidationException("lat and lon must be given together");
        }
        LatLon location = LatLon.of(lat, lon);
        if (!location.isInRange()) {
            throw new RequestValidationException(String.format("Location (%s, %s) is out of range", lat, lon));
        }
        return location;
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new RequestValidationException("User id is required");
        }
    }
}
