package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.venuevibe.orchestrator.cache.CacheKeys;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.LocationNotFoundException;
import com.venuevibe.orchestrator.exception.MalformedResponseException;
import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import com.venuevibe.orchestrator.model.ServiceType;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * OpenStreetMap Nominatim geocoding.
 *
 * <p>Usage policy: at most one request per second and an identifying User-Agent. The
 * {@link OutboundThrottle} waits before every attempt, retries included. Results are cached in
 * the geocode cache for a day.
 */
@Slf4j
@Component
public class NominatimGeocodingClient {

    static final String PROVIDER = "nominatim";

    private final UpstreamHttpClient http;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;
    private final ProviderProperties.Nominatim config;
    private final ExpiringLruCache<GeocodedLocation> cache;
    private final OutboundThrottle throttle;

    public NominatimGeocodingClient(UpstreamHttpClient http,
                                    BackoffRetrier retrier,
                                    ObjectMapper objectMapper,
                                    ProviderProperties properties,
                                    @Qualifier("geocodeCache") ExpiringLruCache<GeocodedLocation> cache,
                                    @Qualifier("nominatimThrottle") OutboundThrottle throttle) {
        this.http = http;
        this.retrier = retrier;
        this.objectMapper = objectMapper;
        this.config = properties.getNominatim();
        this.cache = cache;
        this.throttle = throttle;
    }

    /**
     * Resolves free-form text (city, address, postcode) to coordinates.
     *
     * @throws IllegalArgumentException  when the text is blank
     * @throws LocationNotFoundException when Nominatim has no match
     */
    public GeocodedLocation geocode(String locationText) {
        Preconditions.checkArgument(locationText != null && !locationText.isBlank(),
                "Location text cannot be empty");

        String key = CacheKeys.geocode(locationText);
        Optional<GeocodedLocation> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Geocode cache hit for '{}'", locationText);
            return cached.get();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/search")
                .queryParam("q", locationText.trim())
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .build()
                .encode()
                .toUri();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NOMINATIM, "geocode", log);
        ctx.logRequest(locationText);
        try {
            JsonNode results = fetch("nominatim.search", uri);
            if (!results.isArray() || results.isEmpty()) {
                throw new LocationNotFoundException(locationText);
            }
            JsonNode first = results.get(0);
            GeocodedLocation location = new GeocodedLocation(
                    parseCoordinate(first.path("lat")),
                    parseCoordinate(first.path("lon")),
                    first.path("display_name").asText(locationText));
            cache.set(key, location);
            ctx.logResponse(location.displayName());
            return location;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Turns coordinates back into a human-readable address.
     */
    public String reverseGeocode(double lat, double lng) {
        Preconditions.checkArgument(lat >= -90 && lat <= 90, "Latitude must be between -90 and 90");
        Preconditions.checkArgument(lng >= -180 && lng <= 180, "Longitude must be between -180 and 180");

        String key = CacheKeys.reverseGeocode(lat, lng);
        Optional<GeocodedLocation> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get().displayName();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/reverse")
                .queryParam("lat", lat)
                .queryParam("lon", lng)
                .queryParam("format", "json")
                .build()
                .encode()
                .toUri();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NOMINATIM, "reverseGeocode", log);
        ctx.logRequest(lat + "," + lng);
        try {
            JsonNode result = fetch("nominatim.reverse", uri);
            String displayName = ProviderJson.text(result.path("display_name"));
            if (displayName == null) {
                throw new MalformedResponseException(PROVIDER, "Unable to reverse geocode coordinates");
            }
            cache.set(key, new GeocodedLocation(lat, lng, displayName));
            ctx.logResponse(displayName);
            return displayName;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    private JsonNode fetch(String operation, URI uri) {
        Map<String, String> headers = Map.of(
                "User-Agent", config.getUserAgent(),
                "Accept", "application/json");
        String body = retrier.retry(operation, () -> {
            throttle.acquire();
            return http.get(PROVIDER, uri, headers).bodyOrThrow(PROVIDER);
        }, config.getRetry());
        return ProviderJson.readTree(objectMapper, PROVIDER, body);
    }

    private static double parseCoordinate(JsonNode node) {
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException(PROVIDER, "Invalid coordinate: " + node, e);
        }
    }
}
