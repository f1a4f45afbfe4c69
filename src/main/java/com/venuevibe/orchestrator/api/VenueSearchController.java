package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.config.SearchProperties;
import com.venuevibe.orchestrator.exception.InvalidRequestException;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import com.venuevibe.orchestrator.model.VenuePreferences;
import com.venuevibe.orchestrator.search.VenueSearchResult;
import com.venuevibe.orchestrator.search.VenueSearchService;
import com.venuevibe.orchestrator.service.GeocodingService;
import com.venuevibe.orchestrator.service.QueryPlannerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for venue search.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/venues")
@RequiredArgsConstructor
public class VenueSearchController {

    private final VenueSearchService searchService;
    private final QueryPlannerService queryPlanner;
    private final GeocodingService geocodingService;
    private final SearchProperties searchProperties;

    /**
     * POST /api/v1/venues/search
     */
    @PostMapping("/search")
    public ResponseEntity<VenueSearchResponse> search(@Valid @RequestBody VenueSearchRequest request) {
        GeoPoint location = request.getLocation();
        String locationName = null;
        if (location == null) {
            if (request.getLocationText() == null || request.getLocationText().isBlank()) {
                throw new InvalidRequestException("INVALID_LOCATION",
                        "Either location coordinates or locationText is required");
            }
            GeocodedLocation geocoded = geocodingService.geocode(request.getLocationText());
            location = geocoded.toPoint();
            locationName = geocoded.displayName();
        }

        List<String> queries = hasQueries(request.getQueries())
                ? request.getQueries()
                : queryPlanner.plan(preferencesOf(request));
        int radius = request.getRadius() != null ? request.getRadius() : searchProperties.getDefaultRadiusMeters();

        VenueSearchResult result = searchService.search(queries, location, radius);

        return ResponseEntity.ok(VenueSearchResponse.builder()
                .venues(result.venues())
                .usedQueries(result.usedQueries())
                .location(location)
                .locationName(locationName)
                .build());
    }

    private static boolean hasQueries(List<String> queries) {
        return queries != null && queries.stream().anyMatch(q -> q != null && !q.isBlank());
    }

    private static VenuePreferences preferencesOf(VenueSearchRequest request) {
        VenuePreferences preferences = request.getPreferences() != null
                ? request.getPreferences()
                : new VenuePreferences();
        if (preferences.getOccasion() == null) {
            preferences.setOccasion(request.getOccasion());
        }
        return preferences;
    }
}
