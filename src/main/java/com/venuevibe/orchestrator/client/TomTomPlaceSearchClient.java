package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.cache.CacheKeys;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.ProviderConfigurationException;
import com.venuevibe.orchestrator.exception.QuotaExceededException;
import com.venuevibe.orchestrator.exception.UpstreamException;
import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.Review;
import com.venuevibe.orchestrator.model.ServiceType;
import com.venuevibe.orchestrator.model.VenueCandidate;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TomTom POI search with optional per-POI details (rating, price range, reviews, photos).
 *
 * <p>The free tier allows 2,500 requests a day. Every request, details lookups included,
 * draws from the {@code tomtomQuota}; once it is exhausted searches fail with
 * {@link QuotaExceededException} and details lookups are skipped.
 */
@Slf4j
@Component
public class TomTomPlaceSearchClient implements PlaceSearchProvider {

    static final String PROVIDER = "tomtom";
    private static final Map<String, String> ACCEPT_JSON = Map.of("Accept", "application/json");

    private final UpstreamHttpClient http;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;
    private final ProviderProperties.TomTom config;
    private final ExpiringLruCache<List<VenueCandidate>> cache;
    private final ProviderQuota quota;

    public TomTomPlaceSearchClient(UpstreamHttpClient http,
                                   BackoffRetrier retrier,
                                   ObjectMapper objectMapper,
                                   ProviderProperties properties,
                                   @Qualifier("placeSearchCache") ExpiringLruCache<List<VenueCandidate>> cache,
                                   @Qualifier("tomtomQuota") ProviderQuota quota) {
        this.http = http;
        this.retrier = retrier;
        this.objectMapper = objectMapper;
        this.config = properties.getTomtom();
        this.cache = cache;
        this.quota = quota;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public DispatchPolicy dispatchPolicy() {
        return DispatchPolicy.parallel();
    }

    @Override
    public List<VenueCandidate> search(String query, GeoPoint location, int radiusMeters) {
        String apiKey = requireApiKey();
        int radius = Math.min(radiusMeters, config.getMaxRadiusMeters());
        String key = CacheKeys.placeSearch(PROVIDER, query, location.lat(), location.lng(), radius);
        Optional<List<VenueCandidate>> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/search/2/poiSearch/{query}.json")
                .queryParam("key", apiKey)
                .queryParam("lat", location.lat())
                .queryParam("lon", location.lng())
                .queryParam("radius", radius)
                .queryParam("limit", Math.min(config.getResultLimit(), config.getMaxResultLimit()))
                .encode()
                .buildAndExpand(query)
                .toUri();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.TOMTOM, "poiSearch", log);
        ctx.logRequest(query, "radius", radius, "quotaUsed", quota.used());
        try {
            String body = retrier.retry("tomtom.poiSearch", () -> {
                quota.acquire();
                return http.get(PROVIDER, uri, ACCEPT_JSON).bodyOrThrow(PROVIDER);
            }, config.getRetry());

            List<VenueCandidate> venues = new ArrayList<>();
            for (JsonNode poi : ProviderJson.readTree(objectMapper, PROVIDER, body).path("results")) {
                VenueCandidate venue = toCandidate(poi);
                if (venue != null) {
                    venues.add(config.isFetchDetails() ? withDetails(venue, apiKey) : venue);
                }
            }
            venues = List.copyOf(venues);
            cache.set(key, venues);
            ctx.logResponse(venues.size() + " venues");
            return venues;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    private String requireApiKey() {
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderConfigurationException(PROVIDER,
                    "TOMTOM_API_KEY is not set. Get a free API key at https://developer.tomtom.com/");
        }
        return apiKey;
    }

    VenueCandidate toCandidate(JsonNode poi) {
        String id = ProviderJson.text(poi.path("id"));
        String name = ProviderJson.text(poi.path("poi").path("name"));
        JsonNode position = poi.path("position");
        if (id == null || name == null || !position.path("lat").isNumber() || !position.path("lon").isNumber()) {
            return null;
        }
        return VenueCandidate.builder()
                .placeId("tomtom-" + id)
                .provider(PROVIDER)
                .name(name)
                .address(Optional.ofNullable(ProviderJson.text(poi.path("address").path("freeformAddress")))
                        .orElse(OverpassPlaceSearchClient.ADDRESS_NOT_AVAILABLE))
                .location(new GeoPoint(position.path("lat").asDouble(), position.path("lon").asDouble()))
                .build();
    }

    /**
     * Details are best-effort: any failure, quota exhaustion included, keeps the basic venue.
     */
    private VenueCandidate withDetails(VenueCandidate venue, String apiKey) {
        String entityId = venue.getPlaceId().substring("tomtom-".length());
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/search/2/place.json")
                .queryParam("key", apiKey)
                .queryParam("entityId", entityId)
                .build()
                .encode()
                .toUri();
        try {
            String body = retrier.retry("tomtom.placeDetails", () -> {
                quota.acquire();
                return http.get(PROVIDER, uri, ACCEPT_JSON).bodyOrThrow(PROVIDER);
            }, config.getRetry());
            return applyDetails(venue, ProviderJson.readTree(objectMapper, PROVIDER, body), apiKey);
        } catch (QuotaExceededException e) {
            log.debug("Skipping TomTom details for {}: quota exhausted", entityId);
            return venue;
        } catch (UpstreamException e) {
            log.warn("Failed to get TomTom place details for {}: {}", entityId, e.getMessage());
            return venue;
        }
    }

    VenueCandidate applyDetails(VenueCandidate venue, JsonNode details, String apiKey) {
        VenueCandidate.VenueCandidateBuilder builder = venue.toBuilder();
        if (details.path("rating").isNumber()) {
            builder.rating(details.path("rating").asDouble());
        }
        if (details.path("priceRange").path("value").isNumber()) {
            builder.priceLevel(details.path("priceRange").path("value").asInt());
        }

        List<Review> reviews = new ArrayList<>();
        for (JsonNode review : details.path("reviews")) {
            if (reviews.size() >= config.getMaxReviews()) {
                break;
            }
            reviews.add(Review.builder()
                    .author(review.path("author").asText("Anonymous"))
                    .rating(review.path("rating").asDouble())
                    .text(review.path("text").asText(""))
                    .time(parseEpochSeconds(review.path("date").asText(null)))
                    .build());
        }
        builder.reviews(reviews);

        List<String> photos = new ArrayList<>();
        for (JsonNode photoId : details.path("photos")) {
            if (photos.size() >= config.getMaxPhotos()) {
                break;
            }
            photos.add(UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                    .path("/search/2/poiPhoto")
                    .queryParam("key", apiKey)
                    .queryParam("id", photoId.asText())
                    .queryParam("width", 800)
                    .queryParam("height", 600)
                    .build()
                    .encode()
                    .toUriString());
        }
        builder.photos(photos);
        return builder.build();
    }

    static long parseEpochSeconds(String date) {
        if (date == null) {
            return 0;
        }
        try {
            return OffsetDateTime.parse(date).toEpochSecond();
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            } catch (DateTimeParseException ignored) {
                return 0;
            }
        }
    }
}
