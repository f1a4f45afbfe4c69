package com.venuevibe.orchestrator.client;

import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.VenueCandidate;

import java.util.List;

/**
 * A place-search backend (Overpass, TomTom...).
 *
 * <p>Implementations check their cache first, apply their own outbound limits and retry
 * policy, and return candidates with a provider-scoped {@code placeId}. Upstream failures are
 * thrown; the orchestrator decides what to absorb.
 */
public interface PlaceSearchProvider {

    /**
     * Stable provider name, as used in configuration and cache keys.
     */
    String name();

    boolean isEnabled();

    DispatchPolicy dispatchPolicy();

    /**
     * @param radiusMeters requested radius; providers clamp it to what they support
     */
    List<VenueCandidate> search(String query, GeoPoint location, int radiusMeters);
}
