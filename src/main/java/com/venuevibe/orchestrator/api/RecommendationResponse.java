package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.model.RecommendedVenue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Best matches first, at most five.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

    private List<RecommendedVenue> recommendations;
}
