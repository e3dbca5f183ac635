package com.incidentimpact.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the incident-impact engine.
 *
 * Flow per request:
 * 1. Decode route polylines
 * 2. Fetch one candidate snapshot from the event store (bounding box of all routes)
 * 3. Intersect and ETA-validate each route on the bounded worker pool
 * 4. Record first deliveries per user and hand them to the notification broker
 */
@SpringBootApplication
public class IncidentImpactApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentImpactApplication.class, args);
    }
}
