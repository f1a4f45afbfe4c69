package com.venuevibe.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the caller is planning and what they care about. Feeds query planning and ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VenuePreferences {

    private String occasion;

    @Builder.Default
    private Budget budget = Budget.ANY;

    private Integer groupSize;

    @Builder.Default
    private List<String> dietaryRestrictions = new ArrayList<>();

    private String atmosphere;
    private String additionalPreferences;
}
