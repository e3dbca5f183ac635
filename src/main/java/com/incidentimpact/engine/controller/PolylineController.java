package com.incidentimpact.engine.controller;

import com.incidentimpact.engine.dto.DecodeResult;
import com.incidentimpact.engine.dto.PolylineRequest;
import com.incidentimpact.engine.exception.RequestValidationException;
import com.incidentimpact.engine.model.PolylineFormat;
import com.incidentimpact.engine.service.PolylineCodec;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Polyline", description = "Encoded polyline decoding")
public class PolylineController {

    private final PolylineCodec polylineCodec;

    /**
     * Decode a polyline. Malformed input yields an empty coordinate list and a warning,
     * still with HTTP 200.
     *
     * Example:
     * POST /google_polyline
     * {"polyline": "_p~iF~ps|U_ulLnnqC_mqNvxq`@"}
     */
    @Operation(
            summary = "Decode an encoded polyline",
            description = "Google encoding by default; pass format=here for HERE flexible polylines."
    )
    @PostMapping("/google_polyline")
    public ResponseEntity<DecodeResult> decode(@Valid @RequestBody PolylineRequest request) {
        PolylineFormat format;
        try {
            format = PolylineFormat.fromValue(request.format());
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException(e.getMessage());
        }
        return ResponseEntity.ok(polylineCodec.decode(request.polyline(), format));
    }
}
