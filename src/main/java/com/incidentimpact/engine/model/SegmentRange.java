package com.incidentimpact.engine.model;

/**
 * Inclusive range of route vertex indexes that touch an event geometry.
 */
public record SegmentRange(int startIndex, int endIndex) {

    public SegmentRange {
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException(
                "Invalid segment range [" + startIndex + ", " + endIndex + "]");
        }
    }
}
