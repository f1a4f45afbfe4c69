package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.exception.InvalidRequestException;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import com.venuevibe.orchestrator.service.GeocodingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/v1/geocode
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/geocode")
@RequiredArgsConstructor
public class GeocodeController {

    private final GeocodingService geocodingService;

    @PostMapping
    public ResponseEntity<GeocodedLocation> geocode(@RequestBody GeocodeRequest request) {
        String location = request.getLocation();
        if (location == null || location.isBlank()) {
            throw new InvalidRequestException("MISSING_LOCATION", "Location is required and must be a non-empty string");
        }
        if (location.length() > GeocodingService.MAX_LOCATION_LENGTH) {
            throw new InvalidRequestException("LOCATION_TOO_LONG",
                    "Location must be " + GeocodingService.MAX_LOCATION_LENGTH + " characters or less");
        }

        log.info("Geocode: {}", location);
        return ResponseEntity.ok(geocodingService.geocode(location));
    }
}
