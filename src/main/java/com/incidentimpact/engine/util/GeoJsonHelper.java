package com.incidentimpact.engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.util.Map;

/**
 * Converts JTS geometries to and from GeoJSON maps.
 */
public final class GeoJsonHelper {

    public static final int WGS84_SRID = 4326;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final GeometryFactory WGS84 = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private GeoJsonHelper() {}

    /** JTS Geometry -> GeoJSON map, {@code null} in, {@code null} out. */
    public static Map<String, Object> toGeoJson(Geometry geometry) {
        if (geometry == null) return null;
        GeoJsonWriter writer = new GeoJsonWriter();
        writer.setEncodeCRS(false);
        try {
            return MAPPER.readValue(writer.write(geometry), new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render geometry as GeoJSON", e);
        }
    }

    /**
     * GeoJSON map -> JTS Geometry in SRID 4326.
     *
     * @throws ParseException when the map is not a GeoJSON geometry
     */
    public static Geometry fromGeoJson(Map<String, Object> geoJson) throws ParseException {
        if (geoJson == null) return null;
        String json;
        try {
            json = MAPPER.writeValueAsString(geoJson);
        } catch (JsonProcessingException e) {
            throw new ParseException("GeoJSON is not serializable: " + e.getOriginalMessage());
        }
        Geometry geometry = new GeoJsonReader(WGS84).read(json);
        geometry.setSRID(WGS84_SRID);
        return geometry;
    }

    public static GeometryFactory wgs84Factory() {
        return WGS84;
    }
}
