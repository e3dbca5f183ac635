package com.incidentimpact.engine.service;

import com.incidentimpact.engine.EventFixtures;
import com.incidentimpact.engine.dto.RouteRequest;
import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.exception.EventStoreUnavailableException;
import com.incidentimpact.engine.exception.RequestValidationException;
import com.incidentimpact.engine.model.AffectingEvent;
import com.incidentimpact.engine.model.BoundingBox;
import com.incidentimpact.engine.model.DecodedRoute;
import com.incidentimpact.engine.model.IntersectionResult;
import com.incidentimpact.engine.model.RouteEvaluation;
import com.incidentimpact.engine.model.RouteEvaluation.RouteStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.incidentimpact.engine.EventFixtures.TEN;
import static com.incidentimpact.engine.EventFixtures.TEN_THIRTY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RouteImpactServiceTest {

    private static final Set<EventSourceType> ALL_TYPES = EnumSet.allOf(EventSourceType.class);

    @Mock
    private EventStoreGateway eventStoreGateway;

    private final PolylineCodec polylineCodec = new PolylineCodec(100_000);
    private final EtaValidator etaValidator = new EtaValidator(60.0, 45.0);
    private final Clock clock = Clock.fixed(TEN, ZoneOffset.UTC);

    private ExecutorService executor;
    private RouteImpactService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        service = new RouteImpactService(polylineCodec, eventStoreGateway, new IntersectionEngine(5000),
            etaValidator, executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReportEventActiveAtEta() {
        IncidentEvent incident = EventFixtures.corridorIncident();
        when(eventStoreGateway.queryByBoundingBox(any(), eq(TEN_THIRTY), eq(Duration.ofMinutes(360))))
            .thenReturn(List.of(incident));

        List<RouteEvaluation> results = service.evaluate(
            List.of(RouteRequest.of("commute", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, null);

        assertEquals(1, results.size());
        RouteEvaluation result = results.get(0);
        assertEquals(RouteStatus.OK, result.status());
        assertEquals(3, result.vertexCount());
        assertEquals(1, result.events().size());
        AffectingEvent affecting = result.events().get(0);
        assertSame(incident, affecting.event());
        assertTrue(affecting.eta().isAfter(Instant.parse("2024-06-01T10:44:00Z")));
        assertTrue(affecting.eta().isBefore(Instant.parse("2024-06-01T10:46:00Z")));
    }

    @Test
    void shouldDropEventExpiredBeforeEta() {
        IncidentEvent expired = EventFixtures.corridorIncident();
        expired.setStartTime(Instant.parse("2024-06-01T08:00:00Z"));
        expired.setExpiresAt(TEN);
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any())).thenReturn(List.of(expired));

        List<RouteEvaluation> results = service.evaluate(
            List.of(RouteRequest.of("commute", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, null);

        assertEquals(RouteStatus.OK, results.get(0).status());
        assertTrue(results.get(0).events().isEmpty());
    }

    @Test
    void shouldIsolateMalformedPolylineAndQueryStoreOnce() {
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any()))
            .thenReturn(List.of(EventFixtures.corridorIncident()));
        RouteRequest here = new RouteRequest("here", EventFixtures.CORRIDOR_HERE, "here", null, null, null);

        List<RouteEvaluation> results = service.evaluate(List.of(
            RouteRequest.of("broken", "!!!invalid!!!"),
            RouteRequest.of("google", EventFixtures.CORRIDOR_GOOGLE),
            here), ALL_TYPES, TEN_THIRTY, null);

        assertEquals(List.of("broken", "google", "here"), results.stream().map(RouteEvaluation::routeId).toList());
        assertEquals(RouteStatus.DECODE_ERROR, results.get(0).status());
        assertNotNull(results.get(0).message());
        assertEquals(1, results.get(1).events().size());
        assertEquals(1, results.get(2).events().size());
        verify(eventStoreGateway, times(1)).queryByBoundingBox(any(), any(), any());
    }

    @Test
    void shouldQueryUnionBoxFromEarliestDeparture() {
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any())).thenReturn(List.of());
        RouteRequest later = new RouteRequest("later", EventFixtures.CORRIDOR_GOOGLE, null,
            TEN_THIRTY.plus(Duration.ofHours(2)), null, null);

        service.evaluate(List.of(RouteRequest.of("now", EventFixtures.CORRIDOR_GOOGLE), later),
            ALL_TYPES, null, null);

        ArgumentCaptor<BoundingBox> box = ArgumentCaptor.forClass(BoundingBox.class);
        verify(eventStoreGateway).queryByBoundingBox(box.capture(), eq(TEN),
            eq(Duration.ofMinutes(150).plusMinutes(360)));
        assertEquals(-95.51, box.getValue().minLon(), 1e-9);
        assertEquals(29.71, box.getValue().maxLat(), 1e-9);
    }

    @Test
    void shouldApplyTypeFilter() {
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any()))
            .thenReturn(List.of(EventFixtures.corridorIncident()));

        List<RouteEvaluation> results = service.evaluate(
            List.of(RouteRequest.of("commute", EventFixtures.CORRIDOR_GOOGLE)),
            EnumSet.of(EventSourceType.FLOOD), TEN_THIRTY, null);

        assertTrue(results.get(0).events().isEmpty());
    }

    @Test
    void shouldSkipStoreWhenNothingDecodes() {
        List<RouteEvaluation> results = service.evaluate(
            List.of(RouteRequest.of("broken", "!!!invalid!!!")), ALL_TYPES, TEN_THIRTY, null);

        assertEquals(RouteStatus.DECODE_ERROR, results.get(0).status());
        verifyNoInteractions(eventStoreGateway);
    }

    @Test
    void shouldMarkSlowRouteTimedOutAndKeepCompletedOnes() {
        IntersectionEngine engine = mock(IntersectionEngine.class);
        when(engine.intersect(any(), anyList())).thenAnswer(invocation -> {
            DecodedRoute route = invocation.getArgument(0);
            if (route.id().equals("slow")) {
                Thread.sleep(5_000);
            }
            return new IntersectionResult(List.of(), false, route.vertexCount());
        });
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any())).thenReturn(List.of());
        RouteImpactService withSlowEngine = new RouteImpactService(polylineCodec, eventStoreGateway, engine,
            etaValidator, executor, clock);

        List<RouteEvaluation> results = withSlowEngine.evaluate(List.of(
            RouteRequest.of("fast", EventFixtures.CORRIDOR_GOOGLE),
            RouteRequest.of("slow", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, 300L);

        assertEquals(RouteStatus.OK, results.get(0).status());
        assertEquals(RouteStatus.TIMED_OUT, results.get(1).status());
    }

    @Test
    void shouldCountSlowStoreQueryAgainstDeadline() {
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of(EventFixtures.corridorIncident());
        });

        long started = System.nanoTime();
        List<RouteEvaluation> results = service.evaluate(List.of(
            RouteRequest.of("broken", "!!!invalid!!!"),
            RouteRequest.of("commute", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, 100L);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(elapsedMs < 1_000, "evaluation took " + elapsedMs + " ms");
        assertEquals(RouteStatus.DECODE_ERROR, results.get(0).status());
        assertEquals(RouteStatus.TIMED_OUT, results.get(1).status());
    }

    @Test
    void shouldPropagateStoreFailureFromWorker() {
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any()))
            .thenThrow(new EventStoreUnavailableException("Event store unavailable during bounding box query", null));

        assertThrows(EventStoreUnavailableException.class, () -> service.evaluate(
            List.of(RouteRequest.of("commute", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, null));
    }

    @Test
    void shouldMarkFailingRouteWithoutAbortingBatch() {
        IntersectionEngine engine = mock(IntersectionEngine.class);
        when(engine.intersect(any(), anyList())).thenAnswer(invocation -> {
            DecodedRoute route = invocation.getArgument(0);
            if (route.id().equals("bad")) {
                throw new IllegalStateException("topology exception");
            }
            return new IntersectionResult(List.of(), false, route.vertexCount());
        });
        when(eventStoreGateway.queryByBoundingBox(any(), any(), any())).thenReturn(List.of());
        RouteImpactService withFailingEngine = new RouteImpactService(polylineCodec, eventStoreGateway, engine,
            etaValidator, executor, clock);

        List<RouteEvaluation> results = withFailingEngine.evaluate(List.of(
            RouteRequest.of("bad", EventFixtures.CORRIDOR_GOOGLE),
            RouteRequest.of("good", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, null);

        assertEquals(RouteStatus.FAILED, results.get(0).status());
        assertTrue(results.get(0).message().contains("topology exception"));
        assertEquals(RouteStatus.OK, results.get(1).status());
    }

    @Test
    void shouldRejectDuplicateRouteIds() {
        assertThrows(RequestValidationException.class, () -> service.evaluate(List.of(
            RouteRequest.of("a", EventFixtures.CORRIDOR_GOOGLE),
            RouteRequest.of("a", EventFixtures.CORRIDOR_GOOGLE)), ALL_TYPES, TEN_THIRTY, null));
    }

    @Test
    void shouldRejectUnknownPolylineFormat() {
        RouteRequest route = new RouteRequest("a", EventFixtures.CORRIDOR_GOOGLE, "osm", null, null, null);

        assertThrows(RequestValidationException.class,
            () -> service.evaluate(List.of(route), ALL_TYPES, TEN_THIRTY, null));
        verifyNoInteractions(eventStoreGateway);
    }

    @Test
    void shouldParseCommaSeparatedTypeFilter() {
        assertEquals(EnumSet.of(EventSourceType.INCIDENT, EventSourceType.CLOSURE),
            RouteImpactService.parseTypeFilter("Incident, closure"));
        assertEquals(EnumSet.of(EventSourceType.WEATHER_ALERT), RouteImpactService.parseTypeFilter("WeatherAlert"));
        assertEquals(ALL_TYPES, RouteImpactService.parseTypeFilter(null));
        assertEquals(ALL_TYPES, RouteImpactService.parseTypeFilter(" "));
        assertThrows(RequestValidationException.class, () -> RouteImpactService.parseTypeFilter("Incident,Tornado"));
    }
}
