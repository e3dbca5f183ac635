package com.incidentimpact.engine.exception;

/**
 * The event store could not be reached. Retryable by the caller; the engine makes a
 * single attempt per request.
 */
public class EventStoreUnavailableException extends RuntimeException {

    public EventStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
