package com.incidentimpact.engine.model;

import com.incidentimpact.engine.exception.RequestValidationException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    @Test
    void shouldBuildValidBox() {
        BoundingBox box = BoundingBox.of(-95.5, 29.5, -95.0, 30.0);

        assertEquals(-95.5, box.minLon());
        assertEquals(30.0, box.maxLat());
    }

    @Test
    void shouldRejectMissingBounds() {
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(-95.5, null, -95.0, 30.0));
    }

    @Test
    void shouldRejectOutOfRangeLatitude() {
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(-95.5, -91.0, -95.0, 30.0));
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(-95.5, 29.5, -95.0, 90.5));
    }

    @Test
    void shouldRejectOutOfRangeLongitude() {
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(-181.0, 29.5, -95.0, 30.0));
    }

    @Test
    void shouldRejectInvertedBox() {
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(-95.0, 29.5, -95.5, 30.0));
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(-95.5, 30.0, -95.0, 29.5));
    }

    @Test
    void shouldRejectNaN() {
        assertThrows(RequestValidationException.class, () -> BoundingBox.of(Double.NaN, 29.5, -95.0, 30.0));
    }

    @Test
    void shouldCoverCoordinatesAndExpandWithClamping() {
        BoundingBox box = BoundingBox.covering(List.of(LatLon.of(89.995, 10.0), LatLon.of(80.0, 20.0)));

        BoundingBox expanded = box.expand(0.01);

        assertEquals(9.99, expanded.minLon(), 1e-9);
        assertEquals(90.0, expanded.maxLat(), 1e-9);
        assertNull(BoundingBox.covering(List.of()));
    }

    @Test
    void shouldTestEnvelopeOverlap() {
        BoundingBox box = BoundingBox.of(-95.5, 29.5, -95.0, 30.0);

        assertTrue(box.intersects(new Envelope(-95.6, -95.4, 29.4, 29.6)));
        assertFalse(box.intersects(new Envelope(-94.1, -94.0, 29.6, 29.7)));
        assertFalse(box.intersects(new Envelope()));
    }
}
