package com.venuevibe.orchestrator.search;

import com.venuevibe.orchestrator.model.GeoPoint;

import java.util.List;

/**
 * Fans search queries out to the enabled place-search providers and merges what comes back.
 */
public interface VenueSearchService {

    /**
     * Runs one search pass.
     *
     * <p>Provider failures for individual queries count as empty results, so a pass where every
     * query fails returns an empty result rather than an error. Only a provider configuration
     * error (such as a missing API key) is propagated.
     *
     * @param queries      search terms, dispatched in order
     * @param location     centre of the search
     * @param radiusMeters search radius; providers clamp it to their own maximum
     */
    VenueSearchResult search(List<String> queries, GeoPoint location, int radiusMeters);
}
