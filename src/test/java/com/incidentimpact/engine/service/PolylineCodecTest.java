package com.incidentimpact.engine.service;

import com.incidentimpact.engine.EventFixtures;
import com.incidentimpact.engine.dto.DecodeResult;
import com.incidentimpact.engine.exception.PolylineDecodeException;
import com.incidentimpact.engine.model.LatLon;
import com.incidentimpact.engine.model.PolylineFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolylineCodecTest {

    private static final double EPS = 1e-6;

    private final PolylineCodec codec = new PolylineCodec(100_000);

    @Test
    void shouldDecodeReferenceGooglePolyline() {
        DecodeResult result = codec.decode("_p~iF~ps|U_ulLnnqC_mqNvxq`@", PolylineFormat.GOOGLE);

        assertTrue(result.isSuccess());
        assertNull(result.warning());
        assertEquals(3, result.coordinates().size());
        assertLatLon(38.5, -120.2, result.coordinates().get(0));
        assertLatLon(40.7, -120.95, result.coordinates().get(1));
        assertLatLon(43.252, -126.453, result.coordinates().get(2));
    }

    @Test
    void shouldDecodeReferenceHerePolyline() {
        DecodeResult result = codec.decode("BFoz5xJ67i1B1B7PzIhaxL7Y", PolylineFormat.HERE);

        assertTrue(result.isSuccess());
        assertEquals(4, result.coordinates().size());
        assertLatLon(50.10228, 8.69821, result.coordinates().get(0));
        assertLatLon(50.10201, 8.69567, result.coordinates().get(1));
        assertLatLon(50.10063, 8.69150, result.coordinates().get(2));
        assertLatLon(50.09878, 8.68752, result.coordinates().get(3));
    }

    @Test
    void shouldDecodeCorridorInBothFormats() {
        List<LatLon> google = codec.decode(EventFixtures.CORRIDOR_GOOGLE, PolylineFormat.GOOGLE).coordinates();
        List<LatLon> here = codec.decode(EventFixtures.CORRIDOR_HERE, PolylineFormat.HERE).coordinates();

        assertEquals(EventFixtures.CORRIDOR.size(), google.size());
        assertEquals(EventFixtures.CORRIDOR.size(), here.size());
        for (int i = 0; i < google.size(); i++) {
            assertLatLon(EventFixtures.CORRIDOR.get(i).lat(), EventFixtures.CORRIDOR.get(i).lon(), google.get(i));
            assertLatLon(EventFixtures.CORRIDOR.get(i).lat(), EventFixtures.CORRIDOR.get(i).lon(), here.get(i));
        }
    }

    @Test
    void shouldDegradeMalformedInputToEmptyListWithWarning() {
        DecodeResult result = codec.decode("!!!invalid!!!", PolylineFormat.GOOGLE);

        assertFalse(result.isSuccess());
        assertTrue(result.coordinates().isEmpty());
        assertNotNull(result.warning());
    }

    @Test
    void shouldRejectTruncatedGooglePolyline() {
        // last longitude chunk still has its continuation bit set
        DecodeResult result = codec.decode("_p~iF~ps|U_ulLnnqC_mqNvxq", PolylineFormat.GOOGLE);

        assertFalse(result.isSuccess());
        assertTrue(result.coordinates().isEmpty());
    }

    @Test
    void shouldRejectUnsupportedHereVersion() {
        assertThrows(PolylineDecodeException.class,
            () -> codec.decodeOrThrow("CFoz5xJ67i1B1B7PzIhaxL7Y", PolylineFormat.HERE));
    }

    @Test
    void shouldRejectPolylineAboveLengthLimit() {
        PolylineCodec strict = new PolylineCodec(10);

        DecodeResult result = strict.decode("_p~iF~ps|U_ulLnnqC_mqNvxq`@", PolylineFormat.GOOGLE);

        assertFalse(result.isSuccess());
        assertTrue(result.warning().contains("exceeds limit"));
    }

    @Test
    void shouldReturnEmptyListForEmptyInput() {
        DecodeResult result = codec.decode("", PolylineFormat.GOOGLE);

        assertTrue(result.isSuccess());
        assertTrue(result.coordinates().isEmpty());
    }

    @Test
    void shouldDecodeDeterministically() {
        DecodeResult first = codec.decode("_p~iF~ps|U_ulLnnqC_mqNvxq`@", PolylineFormat.GOOGLE);
        DecodeResult second = codec.decode("_p~iF~ps|U_ulLnnqC_mqNvxq`@", PolylineFormat.GOOGLE);

        assertEquals(first.coordinates(), second.coordinates());
    }

    @Test
    void shouldEncodeKnownVectors() {
        assertEquals("_p~iF~ps|U_ulLnnqC_mqNvxq`@", codec.encodeGoogle(List.of(
            LatLon.of(38.5, -120.2), LatLon.of(40.7, -120.95), LatLon.of(43.252, -126.453))));
        assertEquals(EventFixtures.CORRIDOR_GOOGLE, codec.encodeGoogle(EventFixtures.CORRIDOR));
        assertEquals(EventFixtures.CORRIDOR_HERE, codec.encodeHere(EventFixtures.CORRIDOR));
    }

    private static void assertLatLon(double lat, double lon, LatLon actual) {
        assertEquals(lat, actual.lat(), EPS);
        assertEquals(lon, actual.lon(), EPS);
    }
}
