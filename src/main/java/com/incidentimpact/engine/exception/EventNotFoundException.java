package com.incidentimpact.engine.exception;

public class EventNotFoundException extends RuntimeException {

    public EventNotFoundException(Long eventId) {
        super("Incident event not found: " + eventId);
    }
}
