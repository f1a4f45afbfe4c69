package com.venuevibe.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A venue with the ranking verdict attached. Serialized flat: venue fields plus
 * {@code matchScore}, {@code aiReasoning}, {@code pros} and {@code cons}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendedVenue {

    @JsonUnwrapped
    private VenueCandidate venue;

    /**
     * 0 to 100.
     */
    private int matchScore;

    private String aiReasoning;

    @Builder.Default
    private List<String> pros = new ArrayList<>();

    @Builder.Default
    private List<String> cons = new ArrayList<>();
}
