package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UnreadEventsResponse(
    List<EventRecord> events,
    @JsonProperty("unread_count") int unreadCount
) {

    public static UnreadEventsResponse of(List<EventRecord> events) {
        return new UnreadEventsResponse(events, events.size());
    }
}
