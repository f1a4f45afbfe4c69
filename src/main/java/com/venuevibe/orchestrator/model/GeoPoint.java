package com.venuevibe.orchestrator.model;

import com.google.common.base.Preconditions;

/**
 * WGS84 coordinate pair.
 */
public record GeoPoint(double lat, double lng) {

    public GeoPoint {
        Preconditions.checkArgument(lat >= -90 && lat <= 90, "Latitude must be between -90 and 90");
        Preconditions.checkArgument(lng >= -180 && lng <= 180, "Longitude must be between -180 and 180");
    }

    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }
}
