package com.venuevibe.orchestrator.service;

import com.google.common.base.Preconditions;
import com.venuevibe.orchestrator.client.NominatimGeocodingClient;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Location text to coordinates, with input limits applied before anything goes upstream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeocodingService {

    public static final int MAX_LOCATION_LENGTH = 200;

    private final NominatimGeocodingClient nominatim;

    public GeocodedLocation geocode(String locationText) {
        Preconditions.checkArgument(locationText != null && !locationText.isBlank(),
                "Location is required and must be a non-empty string");
        Preconditions.checkArgument(locationText.length() <= MAX_LOCATION_LENGTH,
                "Location must be %s characters or less", MAX_LOCATION_LENGTH);
        return nominatim.geocode(locationText);
    }

    public String reverseGeocode(double lat, double lng) {
        return nominatim.reverseGeocode(lat, lng);
    }
}
