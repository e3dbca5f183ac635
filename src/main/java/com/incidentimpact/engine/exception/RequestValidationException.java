package com.incidentimpact.engine.exception;

/**
 * Request input that cannot be evaluated (bad bounds, bad filters). Fatal for the
 * request and raised before the event store is queried.
 */
public class RequestValidationException extends RuntimeException {

    public RequestValidationException(String message) {
        super(message);
    }
}
