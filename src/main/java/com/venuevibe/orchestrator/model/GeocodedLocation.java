package com.venuevibe.orchestrator.model;

/**
 * Result of resolving free-form location text.
 */
public record GeocodedLocation(double lat, double lng, String displayName) {

    public GeoPoint toPoint() {
        return new GeoPoint(lat, lng);
    }
}
