package com.incidentimpact.engine.service;

import com.incidentimpact.engine.dto.EventIngestRequest;
import com.incidentimpact.engine.dto.EventIngestResult;
import com.incidentimpact.engine.dto.EventRecord;
import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.exception.EventIngestionException;
import com.incidentimpact.engine.repository.IncidentEventRepository;
import com.incidentimpact.engine.util.GeoJsonHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Optional;

/**
 * Write path used by the feed ingestion jobs.
 *
 * Normalizes a provider payload into an {@link IncidentEvent} and upserts it by
 * external id. Every upsert takes a fresh version from {@link EventVersionClock}, so an
 * update is picked up by incremental sync exactly like a new event. Malformed payloads
 * are rejected here and never reach the query side.
 *
 * Writes hold a transaction-scoped advisory lock from before the version is taken until
 * commit. A version only becomes visible once every lower version has committed, so a
 * poll cursor never moves past an event that is still in flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventIngestionService {

    private static final double METERS_PER_DEGREE_LAT = 111_320.0;
    private static final int BUFFER_QUADRANT_SEGMENTS = 8;
    static final long WRITE_LOCK_KEY = 0x1AC1_DE47L;

    private final IncidentEventRepository eventRepository;
    private final EventVersionClock versionClock;

    @Value("${incident-impact.ingest.point-buffer-meters:150}")
    private double pointBufferMeters = 150.0;

    @Transactional
    public EventIngestResult upsert(EventIngestRequest request) {
        if (request.start().isAfter(request.expires())) {
            throw new EventIngestionException(String.format(
                "Event %s starts at %s, after it expires at %s",
                request.externalId(), request.start(), request.expires()));
        }

        EventSourceType sourceType;
        try {
            sourceType = EventSourceType.fromValue(request.sourceType());
        } catch (IllegalArgumentException e) {
            throw new EventIngestionException(e.getMessage(), e);
        }

        Geometry geometry = normalizeGeometry(request.externalId(), request);

        eventRepository.acquireWriteLock(WRITE_LOCK_KEY);
        Optional<IncidentEvent> existing = eventRepository.findByExternalId(request.externalId());
        IncidentEvent event = existing.orElseGet(IncidentEvent::new);
        event.setExternalId(request.externalId());
        event.setSourceType(sourceType);
        event.setGeometry(geometry);
        event.setStartTime(request.start());
        event.setExpiresAt(request.expires());
        event.setSeverity(request.severity());
        event.setCertainty(request.certainty());
        event.setUrgency(request.urgency());
        event.setHeadline(request.headline());
        event.setDescription(request.description());
        event.setDirectionality(request.directionality());
        event.setRerouteHint(Boolean.TRUE.equals(request.rerouteHint()));
        event.setRawMetadata(request.metadata() == null ? null : new HashMap<>(request.metadata()));
        event.setVersion(versionClock.next());

        IncidentEvent saved = eventRepository.save(event);
        boolean created = existing.isEmpty();
        log.info("{} {}", created ? "Created" : "Updated", saved.toLogString());
        return new EventIngestResult(EventRecord.fromEntity(saved), created);
    }

    private Geometry normalizeGeometry(String externalId, EventIngestRequest request) {
        Geometry geometry;
        try {
            geometry = GeoJsonHelper.fromGeoJson(request.geometry());
        } catch (ParseException | RuntimeException e) {
            throw new EventIngestionException("Event " + externalId + " has unreadable GeoJSON: " + e.getMessage(), e);
        }
        if (geometry == null || geometry.isEmpty()) {
            throw new EventIngestionException("Event " + externalId + " has an empty geometry");
        }

        if (geometry instanceof Point point) {
            geometry = bufferPoint(point);
        } else if (!(geometry instanceof Polygon) && !(geometry instanceof MultiPolygon)) {
            throw new EventIngestionException(String.format(
                "Event %s geometry must be a Point, Polygon or MultiPolygon, got %s",
                externalId, geometry.getGeometryType()));
        }

        IsValidOp validOp = new IsValidOp(geometry);
        if (!validOp.isValid()) {
            TopologyValidationError error = validOp.getValidationError();
            throw new EventIngestionException(String.format(
                "Event %s geometry is invalid: %s at %s", externalId, error.getMessage(), error.getCoordinate()));
        }
        geometry.setSRID(GeoJsonHelper.WGS84_SRID);
        return geometry;
    }

    /**
     * Buffers a point into a polygon of roughly {@code pointBufferMeters} radius. Degrees
     * of longitude shrink with latitude, so the radius uses the larger of the two scales.
     */
    private Geometry bufferPoint(Point point) {
        double latScale = METERS_PER_DEGREE_LAT;
        double lonScale = METERS_PER_DEGREE_LAT * Math.max(Math.cos(Math.toRadians(point.getY())), 0.01);
        double radiusDegrees = pointBufferMeters / Math.min(latScale, lonScale);
        return point.buffer(radiusDegrees, BUFFER_QUADRANT_SEGMENTS);
    }
}
