package com.incidentimpact.engine.model;

import com.incidentimpact.engine.exception.RequestValidationException;
import org.locationtech.jts.geom.Envelope;

import java.util.Collection;

/**
 * Axis-aligned WGS84 rectangle used as the coarse geographic pre-filter.
 * Instances are always valid: use {@link #of} to build one from request input.
 */
public record BoundingBox(double minLon, double minLat, double maxLon, double maxLat) {

    public static BoundingBox of(Double minLon, Double minLat, Double maxLon, Double maxLat) {
        if (minLon == null || minLat == null || maxLon == null || maxLat == null) {
            throw new RequestValidationException("min_lon, min_lat, max_lon and max_lat are required");
        }
        if (!isFinite(minLon) || !isFinite(minLat) || !isFinite(maxLon) || !isFinite(maxLat)) {
            throw new RequestValidationException("Bounding box coordinates must be finite numbers");
        }
        if (minLat < -90.0 || maxLat > 90.0) {
            throw new RequestValidationException("Latitude must be within [-90, 90]");
        }
        if (minLon < -180.0 || maxLon > 180.0) {
            throw new RequestValidationException("Longitude must be within [-180, 180]");
        }
        if (minLon > maxLon || minLat > maxLat) {
            throw new RequestValidationException(String.format(
                "Invalid bounding box: min (%s, %s) exceeds max (%s, %s)", minLon, minLat, maxLon, maxLat));
        }
        return new BoundingBox(minLon, minLat, maxLon, maxLat);
    }

    /**
     * Smallest box holding every coordinate, or {@code null} for an empty collection.
     */
    public static BoundingBox covering(Collection<LatLon> coordinates) {
        if (coordinates.isEmpty()) {
            return null;
        }
        double minLon = Double.POSITIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (LatLon c : coordinates) {
            minLon = Math.min(minLon, c.lon());
            minLat = Math.min(minLat, c.lat());
            maxLon = Math.max(maxLon, c.lon());
            maxLat = Math.max(maxLat, c.lat());
        }
        return of(minLon, minLat, maxLon, maxLat);
    }

    /**
     * Square box of half-width {@code radiusDegrees} around a point.
     */
    public static BoundingBox around(LatLon point, double radiusDegrees) {
        return new BoundingBox(point.lon(), point.lat(), point.lon(), point.lat()).expand(radiusDegrees);
    }

    /**
     * Grows the box by {@code margin} degrees on every side, clamped to valid WGS84 bounds.
     */
    public BoundingBox expand(double margin) {
        return new BoundingBox(
            Math.max(-180.0, minLon - margin),
            Math.max(-90.0, minLat - margin),
            Math.min(180.0, maxLon + margin),
            Math.min(90.0, maxLat + margin));
    }

    public Envelope toEnvelope() {
        return new Envelope(minLon, maxLon, minLat, maxLat);
    }

    public boolean intersects(Envelope envelope) {
        return envelope != null && !envelope.isNull() && toEnvelope().intersects(envelope);
    }

    private static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }
}
