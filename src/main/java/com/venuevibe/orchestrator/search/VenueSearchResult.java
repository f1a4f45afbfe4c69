package com.venuevibe.orchestrator.search;

import com.venuevibe.orchestrator.model.VenueCandidate;

import java.util.List;

/**
 * Outcome of one search pass: the merged, filtered and truncated venues plus the queries that
 * were dispatched.
 */
public record VenueSearchResult(List<VenueCandidate> venues, List<String> usedQueries) {

    public static VenueSearchResult empty(List<String> usedQueries) {
        return new VenueSearchResult(List.of(), usedQueries);
    }
}
