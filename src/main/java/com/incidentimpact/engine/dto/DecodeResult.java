package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.incidentimpact.engine.model.LatLon;

import java.util.List;

/**
 * Outcome of decoding an encoded polyline. A failed decode carries an empty coordinate
 * list and the reason in {@code warning}; it is never an exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecodeResult(List<LatLon> coordinates, String warning) {

    public DecodeResult {
        coordinates = coordinates == null ? List.of() : List.copyOf(coordinates);
    }

    public static DecodeResult success(List<LatLon> coordinates) {
        return new DecodeResult(coordinates, null);
    }

    public static DecodeResult failure(String warning) {
        return new DecodeResult(List.of(), warning);
    }

    public boolean isSuccess() {
        return warning == null;
    }
}
