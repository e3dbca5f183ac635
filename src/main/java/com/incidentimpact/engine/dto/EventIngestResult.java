package com.incidentimpact.engine.dto;

/**
 * @param event   stored event after the upsert
 * @param created {@code true} when no event with the external id existed before
 */
public record EventIngestResult(EventRecord event, boolean created) {
}
