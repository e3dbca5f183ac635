package com.incidentimpact.engine.controller;

import com.incidentimpact.engine.dto.EventIngestRequest;
import com.incidentimpact.engine.dto.EventIngestResult;
import com.incidentimpact.engine.dto.IncidentEventsResponse;
import com.incidentimpact.engine.model.BoundingBox;
import com.incidentimpact.engine.service.EventCacheService;
import com.incidentimpact.engine.service.EventIngestionService;
import com.incidentimpact.engine.service.NotificationTargetingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

/**
 * Event-centric endpoints: area sync, ingestion and read acknowledgment.
 */
@RestController
@RequestMapping("/incident_events")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Incident Events", description = "Area sync, ingestion and acknowledgment of hazard events")
public class IncidentEventController {

    private final NotificationTargetingService targetingService;
    private final EventIngestionService ingestionService;
    private final EventCacheService eventCacheService;
    private final Clock clock;

    /**
     * Events in a bounding box.
     *
     * Example:
     * GET /incident_events?min_lon=-95.5&max_lon=-95.0&min_lat=29.5&max_lat=30.0&version=1718000000000
     *
     * Without {@code version} every active event in the box is returned. With it, every
     * event changed since that version comes back flagged with {@code is_affected}.
     */
    @Operation(
            summary = "Events in a bounding box",
            description = "Full sync without a version cursor, incremental sync with one. " +
                    "The response version is the cursor for the next poll."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Events and the next cursor",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = "{\"events\":[{\"event\":{\"id\":42,\"external_id\":\"TX-1001\",\"source_type\":\"INCIDENT\"},\"is_affected\":true}],\"version\":1718000000123}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "Invalid bounding box"),
            @ApiResponse(responseCode = "503", description = "Event store unavailable, retry later")
    })
    @GetMapping
    public ResponseEntity<IncidentEventsResponse> getEvents(
        @Parameter(description = "Western edge", example = "-95.5") @RequestParam(name = "min_lon", required = false) Double minLon,
        @Parameter(description = "Eastern edge", example = "-95.0") @RequestParam(name = "max_lon", required = false) Double maxLon,
        @Parameter(description = "Southern edge", example = "29.5") @RequestParam(name = "min_lat", required = false) Double minLat,
        @Parameter(description = "Northern edge", example = "30.0") @RequestParam(name = "max_lat", required = false) Double maxLat,
        @Parameter(description = "Last version seen by the client") @RequestParam(name = "version", required = false) Long version
    ) {
        BoundingBox box = BoundingBox.of(minLon, minLat, maxLon, maxLat);
        return ResponseEntity.ok(targetingService.poll(version, box));
    }

    /**
     * Upsert a provider event. Used by the feed ingestion jobs.
     *
     * Example:
     * PUT /incident_events
     * {
     *   "external_id": "TX-1001",
     *   "source_type": "Incident",
     *   "geometry": {"type": "Point", "coordinates": [-95.4, 29.6]},
     *   "start": "2024-06-01T10:00:00Z",
     *   "expires": "2024-06-01T12:00:00Z"
     * }
     */
    @Operation(
            summary = "Ingest an event",
            description = "Creates or updates the event with the given external_id. Points are buffered " +
                    "into polygons. Every upsert assigns a new version."
    )
    @PutMapping
    public ResponseEntity<EventIngestResult> ingest(@Valid @RequestBody EventIngestRequest request) {
        log.info("Ingesting event {} ({})", request.externalId(), request.sourceType());
        EventIngestResult result = ingestionService.upsert(request);
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    /**
     * Mark an event read for the calling user.
     *
     * Example:
     * POST /incident_events/42/read
     * X-User-Id: user-17
     */
    @Operation(summary = "Acknowledge an event", description = "Marks the event read for the user in X-User-Id.")
    @PostMapping("/{eventId}/read")
    public ResponseEntity<?> acknowledge(
        @RequestHeader(name = "X-User-Id", required = false) String userId,
        @PathVariable Long eventId
    ) {
        boolean changed = targetingService.acknowledge(userId, eventId);
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "eventId", eventId,
            "read", true,
            "changed", changed
        ));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Incident Impact Engine",
            "cacheEnabled", eventCacheService.isEnabled(),
            "timestamp", clock.instant()
        ));
    }
}
