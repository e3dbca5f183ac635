package com.incidentimpact.engine.entity;

import java.util.Locale;

/**
 * Provider family an incident event was normalized from.
 */
public enum EventSourceType {
    INCIDENT,
    DMS,
    FLOOD,
    CLOSURE,
    WEATHER_ALERT;

    /**
     * Case-insensitive parse accepting both {@code WEATHER_ALERT} and {@code WeatherAlert} spellings.
     */
    public static EventSourceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        String normalized = value.trim().replace("-", "_");
        if (normalized.equalsIgnoreCase("weatheralert")) {
            return WEATHER_ALERT;
        }
        return EventSourceType.valueOf(normalized.toUpperCase(Locale.ROOT));
    }
}
