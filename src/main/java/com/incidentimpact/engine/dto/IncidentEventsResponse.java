package com.incidentimpact.engine.dto;

import java.util.List;

/**
 * @param events  events changed since the caller's cursor (or all active events in the box)
 * @param version cursor to send on the next poll
 */
public record IncidentEventsResponse(List<PolledEventRecord> events, long version) {
}
