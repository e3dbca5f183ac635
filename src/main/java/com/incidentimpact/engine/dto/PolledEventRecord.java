package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An event returned by the incremental poll, flagged with whether it still applies to
 * the caller's area.
 */
public record PolledEventRecord(
    EventRecord event,
    @JsonProperty("is_affected") boolean isAffected
) {
}
