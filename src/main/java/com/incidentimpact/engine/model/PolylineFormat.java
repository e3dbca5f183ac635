package com.incidentimpact.engine.model;

import java.util.Locale;

/**
 * Supported encoded-polyline variants.
 */
public enum PolylineFormat {
    GOOGLE,
    HERE;

    /**
     * Parses a request value; {@code null} or blank means {@link #GOOGLE}.
     */
    public static PolylineFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return GOOGLE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "google" -> GOOGLE;
            case "here", "flexible" -> HERE;
            default -> throw new IllegalArgumentException("Unsupported polyline format: " + value);
        };
    }
}
