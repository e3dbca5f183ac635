package com.incidentimpact.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidentimpact.engine.model.RouteEvaluation;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteEvaluationResult(
    @JsonProperty("route_id") String routeId,
    RouteEvaluation.RouteStatus status,
    boolean truncated,
    @JsonProperty("vertex_count") int vertexCount,
    List<AffectingEventRecord> events,
    String message
) {
}
