package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.model.VenueCandidate;
import com.venuevibe.orchestrator.model.VenuePreferences;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

    private List<VenueCandidate> venues;
    private VenuePreferences preferences;
}
