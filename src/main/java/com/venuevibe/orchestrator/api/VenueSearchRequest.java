package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.VenuePreferences;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Venue search request. Either {@code location} or {@code locationText} is required; when
 * {@code queries} is empty they are planned from the occasion and preferences.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VenueSearchRequest {

    private String occasion;

    @Size(max = 10)
    private List<String> queries;

    @Size(max = 200)
    private String locationText;

    private GeoPoint location;

    @Positive
    @Max(100_000)
    private Integer radius;

    private VenuePreferences preferences;
}
