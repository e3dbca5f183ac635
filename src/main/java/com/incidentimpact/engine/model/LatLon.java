package com.incidentimpact.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.locationtech.jts.geom.Coordinate;

/**
 * A WGS84 position in decimal degrees.
 *
 * @param lat latitude (-90 to 90)
 * @param lon longitude (-180 to 180)
 */
public record LatLon(double lat, double lon) {

    public static LatLon of(double lat, double lon) {
        return new LatLon(lat, lon);
    }

    /**
     * JTS coordinate for this position. JTS uses (X, Y) = (longitude, latitude).
     */
    public Coordinate toCoordinate() {
        return new Coordinate(lon, lat);
    }

    @JsonIgnore
    public boolean isInRange() {
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }
}
