package com.incidentimpact.engine.model;

import java.time.Instant;

/**
 * Outcome of the temporal and directional check for one intersection.
 *
 * @param affecting whether the event affects the trip
 * @param eta       estimated arrival at the matched range, {@code null} when it could not be computed
 * @param range     range the verdict refers to
 * @param outcome   reason for the verdict
 */
public record EtaValidation(boolean affecting, Instant eta, SegmentRange range, Outcome outcome) {

    public enum Outcome {
        AFFECTING,
        NOT_YET_ACTIVE,
        EXPIRED,
        DIRECTION_MISMATCH,
        COMPUTATION_ERROR
    }

    public static EtaValidation affecting(Instant eta, SegmentRange range) {
        return new EtaValidation(true, eta, range, Outcome.AFFECTING);
    }

    public static EtaValidation rejected(Instant eta, SegmentRange range, Outcome outcome) {
        return new EtaValidation(false, eta, range, outcome);
    }

    public static EtaValidation failed(SegmentRange range) {
        return new EtaValidation(false, null, range, Outcome.COMPUTATION_ERROR);
    }
}
