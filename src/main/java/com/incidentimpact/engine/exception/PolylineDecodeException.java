package com.incidentimpact.engine.exception;

/**
 * Malformed encoded polyline. Raised inside the codec and converted into a failed
 * {@code DecodeResult} at its public boundary.
 */
public class PolylineDecodeException extends RuntimeException {

    public PolylineDecodeException(String message, int position) {
        super(message + " (at index " + position + ")");
    }
}
