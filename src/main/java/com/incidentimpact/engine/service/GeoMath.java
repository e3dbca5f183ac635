package com.incidentimpact.engine.service;

import com.incidentimpact.engine.model.LatLon;

/**
 * Spherical helpers for distances and bearings along a route.
 */
final class GeoMath {

    static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    private GeoMath() {}

    /**
     * Great-circle distance in meters (haversine).
     */
    static double distanceMeters(LatLon from, LatLon to) {
        double lat1 = Math.toRadians(from.lat());
        double lat2 = Math.toRadians(to.lat());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(normalizeDeltaLongitude(to.lon() - from.lon()));

        double sinHalfLat = Math.sin(dLat * 0.5d);
        double sinHalfLon = Math.sin(dLon * 0.5d);
        double a = sinHalfLat * sinHalfLat + Math.cos(lat1) * Math.cos(lat2) * sinHalfLon * sinHalfLon;
        return 2.0d * EARTH_MEAN_RADIUS_METERS * Math.asin(Math.sqrt(Math.min(1.0d, Math.max(0.0d, a))));
    }

    /**
     * Initial compass bearing in degrees [0, 360) from {@code from} towards {@code to}.
     */
    static double initialBearingDegrees(LatLon from, LatLon to) {
        double lat1 = Math.toRadians(from.lat());
        double lat2 = Math.toRadians(to.lat());
        double dLon = Math.toRadians(normalizeDeltaLongitude(to.lon() - from.lon()));

        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        double bearing = Math.toDegrees(Math.atan2(y, x));
        return (bearing + 360.0d) % 360.0d;
    }

    /**
     * Smallest absolute difference between two bearings, in [0, 180].
     */
    static double angularDifference(double a, double b) {
        double diff = Math.abs(a - b) % 360.0d;
        return diff > 180.0d ? 360.0d - diff : diff;
    }

    /**
     * Normalizes delta-longitude into (-180, 180].
     */
    static double normalizeDeltaLongitude(double deltaLon) {
        double normalized = ((deltaLon + 540.0d) % 360.0d) - 180.0d;
        return normalized == -180.0d ? 180.0d : normalized;
    }
}
