package com.venuevibe.orchestrator.cache;

import java.util.Locale;

/**
 * Key normalization for the cache domains. The caches store whatever key they are given;
 * equivalent requests must be reduced to the same key here.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * {@code "  New   York, NY "} and {@code "new york, ny"} share one geocoding entry.
     */
    public static String geocode(String locationText) {
        return "geocode:" + normalizeText(locationText);
    }

    public static String reverseGeocode(double lat, double lng) {
        return String.format(Locale.ROOT, "reverse:%.4f,%.4f", lat, lng);
    }

    /**
     * Coordinates are rounded to three decimals (about 110 m) so nearby searches share results.
     */
    public static String placeSearch(String provider, String query, double lat, double lng, int radiusMeters) {
        return String.format(Locale.ROOT, "%s:%s|%.3f|%.3f|%d",
                provider, normalizeText(query), lat, lng, radiusMeters);
    }

    static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
