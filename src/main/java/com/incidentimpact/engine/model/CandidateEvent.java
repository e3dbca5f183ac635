package com.incidentimpact.engine.model;

import com.incidentimpact.engine.entity.IncidentEvent;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * An event prepared for repeated intersection tests. Built once per request from the
 * candidate snapshot and shared read-only across route workers; JTS prepared geometries
 * are safe for concurrent use.
 */
public record CandidateEvent(IncidentEvent event, PreparedGeometry prepared, Envelope envelope) {

    public static CandidateEvent prepare(IncidentEvent event) {
        return new CandidateEvent(
            event,
            PreparedGeometryFactory.prepare(event.getGeometry()),
            event.getGeometry().getEnvelopeInternal());
    }
}
