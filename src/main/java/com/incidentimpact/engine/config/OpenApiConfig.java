package com.incidentimpact.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI incidentImpactOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Incident Impact API")
                        .description("Determines which planned or in-progress routes are affected by active " +
                                "hazard events (incidents, DMS messages, floods, closures, weather alerts) " +
                                "and tracks per-user delivery and read state.\n\n" +
                                "## Endpoints\n\n" +
                                "- `GET /incident_events` - events in a bounding box, incremental by version cursor\n" +
                                "- `POST /user_informatic_events` - events affecting each of the caller's routes\n" +
                                "- `POST /google_polyline` - decode an encoded polyline\n" +
                                "- `GET /unread_events` - affecting events the user has not read\n\n" +
                                "Per-user deliveries are pushed to `/user/queue/incident-events` over STOMP " +
                                "at `ws://localhost:" + serverPort + "/ws/incident-events`.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
