package com.incidentimpact.engine.controller;

import com.incidentimpact.engine.dto.RouteEvaluationResult;
import com.incidentimpact.engine.dto.UnreadEventsResponse;
import com.incidentimpact.engine.dto.UserInformaticEventsRequest;
import com.incidentimpact.engine.service.NotificationTargetingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * User-centric endpoints: which events affect my routes, and what have I not read.
 * The user is identified by the {@code X-User-Id} header set by the gateway in front
 * of this service.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Route Impact", description = "Events affecting a user's planned or in-progress routes")
public class RouteImpactController {

    private final NotificationTargetingService targetingService;

    /**
     * Per-route affecting events.
     *
     * Example request:
     * POST /user_informatic_events
     * X-User-Id: user-17
     * {
     *   "routes": [{"id": "commute", "polyline": "_v`sD~i{eQ_pR_pR_pR_pR"}],
     *   "type": "Incident,Closure",
     *   "departure_time": "2024-06-01T10:30:00Z"
     * }
     */
    @Operation(
            summary = "Events affecting the caller's routes",
            description = "Decodes each route, intersects it with active events and keeps the events " +
                    "active at the estimated arrival time. A malformed polyline only fails its own route."
    )
    @PostMapping("/user_informatic_events")
    public ResponseEntity<?> userInformaticEvents(
        @RequestHeader(name = "X-User-Id", required = false) String userId,
        @io.swagger.v3.oas.annotations.parameters.RequestBody(
                description = "Routes to evaluate, optional type filter and departure time",
                required = true,
                content = @Content(
                        schema = @Schema(implementation = UserInformaticEventsRequest.class),
                        examples = @ExampleObject(
                                value = "{\"routes\":[{\"id\":\"commute\",\"polyline\":\"_v`sD~i{eQ_pR_pR_pR_pR\"}],\"type\":\"Incident\",\"departure_time\":\"2024-06-01T10:30:00Z\"}"
                        )
                )
        )
        @Valid @RequestBody UserInformaticEventsRequest request
    ) {
        log.info("Evaluating {} routes for user {}", request.routes().size(), userId);
        List<RouteEvaluationResult> routes = targetingService.affectingEvents(userId, request);
        return ResponseEntity.ok(Map.of("routes", routes));
    }

    /**
     * Unread affecting events.
     *
     * Example:
     * GET /unread_events?lat=29.6&lon=-95.4
     * X-User-Id: user-17
     */
    @Operation(
            summary = "Unread events for the caller",
            description = "With a location, active events covering it are delivered first."
    )
    @GetMapping("/unread_events")
    public ResponseEntity<UnreadEventsResponse> unreadEvents(
        @RequestHeader(name = "X-User-Id", required = false) String userId,
        @Parameter(description = "Current latitude", example = "29.6") @RequestParam(required = false) Double lat,
        @Parameter(description = "Current longitude", example = "-95.4") @RequestParam(required = false) Double lon
    ) {
        return ResponseEntity.ok(targetingService.unreadEvents(userId, lat, lon));
    }
}
