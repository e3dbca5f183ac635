package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentimpact.engine.model.AffectingEvent;

import java.time.Instant;

/**
 * An event affecting one of the caller's routes.
 *
 * @param event        the event
 * @param isAffected   always {@code true} for returned events
 * @param eta          estimated arrival at the affected part of the route
 * @param segmentStart first affected route vertex
 * @param segmentEnd   last affected route vertex
 * @param read         whether the user already acknowledged the event
 */
public record AffectingEventRecord(
    EventRecord event,
    @JsonProperty("is_affected") boolean isAffected,
    Instant eta,
    @JsonProperty("segment_start") int segmentStart,
    @JsonProperty("segment_end") int segmentEnd,
    boolean read
) {

    public static AffectingEventRecord from(AffectingEvent affecting, boolean read) {
        return new AffectingEventRecord(
            EventRecord.fromEntity(affecting.event()),
            true,
            affecting.eta(),
            affecting.range().startIndex(),
            affecting.range().endIndex(),
            read
        );
    }
}
