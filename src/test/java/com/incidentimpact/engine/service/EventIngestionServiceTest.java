package com.incidentimpact.engine.service;

import com.incidentimpact.engine.EventFixtures;
import com.incidentimpact.engine.dto.EventIngestRequest;
import com.incidentimpact.engine.dto.EventIngestResult;
import com.incidentimpact.engine.entity.EventSourceType;
import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.exception.EventIngestionException;
import com.incidentimpact.engine.repository.IncidentEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.incidentimpact.engine.EventFixtures.NOON;
import static com.incidentimpact.engine.EventFixtures.TEN;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventIngestionServiceTest {

    @Mock
    private IncidentEventRepository eventRepository;

    @Mock
    private EventVersionClock versionClock;

    private EventIngestionService service;

    @BeforeEach
    void setUp() {
        service = new EventIngestionService(eventRepository, versionClock);
    }

    @Test
    void shouldUpdateExistingEventAndBumpVersion() {
        IncidentEvent stored = EventFixtures.corridorIncident();
        stored.setId(7L);
        stored.setVersion(1000L);
        when(eventRepository.findByExternalId("TX-1001")).thenReturn(Optional.of(stored));
        when(versionClock.next()).thenReturn(2000L);
        when(eventRepository.save(any(IncidentEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        EventIngestResult result = service.upsert(request("TX-1001", square(-95.45, 29.55, 0.05)));

        assertFalse(result.created());
        assertEquals(7L, result.event().id());
        assertEquals(2000L, result.event().version());
        assertTrue(stored.getGeometry().getEnvelopeInternal().covers(new Coordinate(-95.43, 29.57)));
        assertFalse(stored.getGeometry().getEnvelopeInternal().covers(new Coordinate(-95.54, 29.56)));
        verify(eventRepository, times(1)).save(stored);
    }

    @Test
    void shouldCreateNewEvent() {
        when(eventRepository.findByExternalId("TX-5005")).thenReturn(Optional.empty());
        when(versionClock.next()).thenReturn(3000L);
        when(eventRepository.save(any(IncidentEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        EventIngestResult result = service.upsert(request("TX-5005", square(-95.45, 29.55, 0.05)));

        assertTrue(result.created());
        assertEquals(EventSourceType.INCIDENT, result.event().sourceType());
        assertEquals(3000L, result.event().version());
        assertEquals(Map.of("provider", "transtar"), result.event().metadata());
    }

    @Test
    void shouldTakeWriteLockBeforeReadingOrVersioning() {
        when(eventRepository.findByExternalId("TX-5005")).thenReturn(Optional.empty());
        when(versionClock.next()).thenReturn(3000L);
        when(eventRepository.save(any(IncidentEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.upsert(request("TX-5005", square(-95.45, 29.55, 0.05)));

        InOrder inOrder = inOrder(eventRepository, versionClock);
        inOrder.verify(eventRepository).acquireWriteLock(EventIngestionService.WRITE_LOCK_KEY);
        inOrder.verify(eventRepository).findByExternalId("TX-5005");
        inOrder.verify(versionClock).next();
        inOrder.verify(eventRepository).save(any(IncidentEvent.class));
    }

    @Test
    void shouldBufferPointIntoPolygon() {
        when(eventRepository.findByExternalId("DMS-1")).thenReturn(Optional.empty());
        when(versionClock.next()).thenReturn(1L);
        when(eventRepository.save(any(IncidentEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.upsert(request("DMS-1", Map.of("type", "Point", "coordinates", List.of(-95.4, 29.6))));

        ArgumentCaptor<IncidentEvent> saved = ArgumentCaptor.forClass(IncidentEvent.class);
        verify(eventRepository).save(saved.capture());
        Geometry geometry = saved.getValue().getGeometry();
        assertEquals("Polygon", geometry.getGeometryType());
        assertEquals(4326, geometry.getSRID());
        Envelope envelope = geometry.getEnvelopeInternal();
        assertTrue(envelope.covers(new Coordinate(-95.4, 29.6)));
        // 150 m is about 0.0016 degrees of longitude at this latitude
        assertTrue(envelope.getWidth() > 0.002 && envelope.getWidth() < 0.005, "width " + envelope.getWidth());
    }

    @Test
    void shouldRejectWindowEndingBeforeStart() {
        EventIngestRequest backwards = new EventIngestRequest("TX-1", "Incident", square(-95.45, 29.55, 0.05),
            NOON, TEN, null, null, null, null, null, null, null, null);

        assertThrows(EventIngestionException.class, () -> service.upsert(backwards));
        verifyNoInteractions(eventRepository, versionClock);
    }

    @Test
    void shouldRejectLineGeometry() {
        Map<String, Object> line = Map.of("type", "LineString",
            "coordinates", List.of(List.of(-95.5, 29.5), List.of(-95.4, 29.6)));

        assertThrows(EventIngestionException.class, () -> service.upsert(request("TX-1", line)));
        verify(eventRepository, never()).save(any());
    }

    @Test
    void shouldRejectSelfIntersectingPolygon() {
        Map<String, Object> bowtie = Map.of("type", "Polygon", "coordinates", List.of(List.of(
            List.of(-95.5, 29.5), List.of(-95.4, 29.6), List.of(-95.4, 29.5), List.of(-95.5, 29.6), List.of(-95.5, 29.5))));

        EventIngestionException e = assertThrows(EventIngestionException.class,
            () -> service.upsert(request("TX-1", bowtie)));
        assertTrue(e.getMessage().contains("invalid"));
    }

    @Test
    void shouldRejectUnknownSourceType() {
        EventIngestRequest tornado = new EventIngestRequest("TX-1", "Tornado", square(-95.45, 29.55, 0.05),
            TEN, NOON, null, null, null, null, null, null, null, null);

        assertThrows(EventIngestionException.class, () -> service.upsert(tornado));
    }

    private static EventIngestRequest request(String externalId, Map<String, Object> geometry) {
        return new EventIngestRequest(externalId, "Incident", geometry, TEN, NOON,
            "Moderate", "Observed", "Immediate", "Crash", "Two lanes blocked", null, true,
            Map.of("provider", "transtar"));
    }

    private static Map<String, Object> square(double lon, double lat, double size) {
        return Map.of("type", "Polygon", "coordinates", List.of(List.of(
            List.of(lon, lat),
            List.of(lon + size, lat),
            List.of(lon + size, lat + size),
            List.of(lon, lat + size),
            List.of(lon, lat))));
    }
}
