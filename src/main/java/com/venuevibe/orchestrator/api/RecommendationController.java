package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.exception.InvalidRequestException;
import com.venuevibe.orchestrator.model.RecommendedVenue;
import com.venuevibe.orchestrator.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /api/v1/recommendations
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    @PostMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestBody RecommendationRequest request) {
        if (request.getVenues() == null || request.getVenues().isEmpty()) {
            throw new InvalidRequestException("MISSING_VENUES", "Venues array is required and must not be empty");
        }
        if (request.getPreferences() == null) {
            throw new InvalidRequestException("MISSING_PREFERENCES", "Preferences object is required");
        }
        String occasion = request.getPreferences().getOccasion();
        if (occasion == null || occasion.isBlank()) {
            throw new InvalidRequestException("MISSING_OCCASION", "Occasion is required in preferences");
        }

        log.info("Ranking {} venues for '{}'", request.getVenues().size(), occasion);
        List<RecommendedVenue> recommendations =
                recommendationService.recommend(request.getVenues(), request.getPreferences());
        return ResponseEntity.ok(new RecommendationResponse(recommendations));
    }
}
