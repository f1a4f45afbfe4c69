package com.venuevibe.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.VenueCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VenueSearchResponse {

    private List<VenueCandidate> venues;
    private List<String> usedQueries;

    /**
     * Search centre actually used, geocoded when the request only had text.
     */
    private GeoPoint location;

    private String locationName;
}
