package com.incidentimpact.engine.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Named directions of travel an event can be restricted to, with their compass bearing.
 */
public enum TravelDirection {
    NORTHBOUND(0.0),
    EASTBOUND(90.0),
    SOUTHBOUND(180.0),
    WESTBOUND(270.0);

    private final double bearingDegrees;

    TravelDirection(double bearingDegrees) {
        this.bearingDegrees = bearingDegrees;
    }

    public double bearingDegrees() {
        return bearingDegrees;
    }

    /**
     * Parses free-text directionality such as "Northbound", "NB" or "north".
     * Returns empty for blank input and for values that mean both directions.
     *
     * @throws IllegalArgumentException for text that names no known direction
     */
    public static Optional<TravelDirection> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace(" ", "");
        return switch (normalized) {
            case "northbound", "nb", "north", "n" -> Optional.of(NORTHBOUND);
            case "eastbound", "eb", "east", "e" -> Optional.of(EASTBOUND);
            case "southbound", "sb", "south", "s" -> Optional.of(SOUTHBOUND);
            case "westbound", "wb", "west", "w" -> Optional.of(WESTBOUND);
            case "both", "all", "bothdirections", "alldirections" -> Optional.empty();
            default -> throw new IllegalArgumentException("Unknown travel direction: " + value);
        };
    }
}
