package com.incidentimpact.engine.exception;

/**
 * Provider payload rejected at the ingestion boundary (invalid geometry, bad window).
 */
public class EventIngestionException extends RuntimeException {

    public EventIngestionException(String message) {
        super(message);
    }

    public EventIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
