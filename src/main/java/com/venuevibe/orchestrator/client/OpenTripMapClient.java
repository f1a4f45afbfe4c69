package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.UpstreamException;
import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.ServiceType;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Popularity, preview image and Wikipedia extract from OpenTripMap.
 *
 * <p>Optional: without {@code OPENTRIPMAP_API_KEY} every lookup returns empty. A lookup is a
 * radius search by name around the venue followed by a details call for the best match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenTripMapClient {

    static final String PROVIDER = "opentripmap";

    private final UpstreamHttpClient http;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;
    private final ProviderProperties properties;

    /**
     * @param rate popularity, 1 to 3 (7 marks heritage sites); 0 when unknown
     */
    public record Place(int rate, String imageUrl, String text) {

        /**
         * Popularity mapped onto a five-star scale: 1 becomes 3, 2 becomes 4, 3 and above cap at 5.
         */
        public Optional<Double> rating() {
            return rate > 0 ? Optional.of(Math.min(5.0, rate + 2.0)) : Optional.empty();
        }
    }

    public boolean isEnabled() {
        String apiKey = properties.getOpentripmap().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    public Optional<Place> lookup(String name, GeoPoint location) {
        if (!isEnabled() || name == null || location == null) {
            return Optional.empty();
        }
        ProviderProperties.OpenTripMap config = properties.getOpentripmap();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OPENTRIPMAP, "lookup", log);
        ctx.logRequest(name);
        try {
            URI searchUri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                    .path("/places/radius")
                    .queryParam("radius", config.getSearchRadiusMeters())
                    .queryParam("lon", location.lng())
                    .queryParam("lat", location.lat())
                    .queryParam("name", name)
                    .queryParam("limit", 1)
                    .queryParam("apikey", config.getApiKey())
                    .build()
                    .encode()
                    .toUri();
            JsonNode features = fetch("opentripmap.radius", searchUri, config).path("features");
            String xid = ProviderJson.text(features.path(0).path("properties").path("xid"));
            if (xid == null) {
                ctx.logResponse("no match");
                return Optional.empty();
            }

            URI detailsUri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                    .path("/places/xid/{xid}")
                    .queryParam("apikey", config.getApiKey())
                    .encode()
                    .buildAndExpand(xid)
                    .toUri();
            JsonNode details = fetch("opentripmap.xid", detailsUri, config);
            Place place = new Place(
                    parseRate(details.path("rate")),
                    ProviderJson.text(details.path("preview").path("source")),
                    ProviderJson.text(details.path("wikipedia_extracts").path("text")));
            ctx.logResponse("xid=" + xid + ", rate=" + place.rate());
            return Optional.of(place);
        } catch (UpstreamException e) {
            ctx.logError(e.getMessage(), e);
            return Optional.empty();
        }
    }

    private JsonNode fetch(String operation, URI uri, ProviderProperties.OpenTripMap config) {
        String body = retrier.retry(operation,
                () -> http.get(PROVIDER, uri, Map.of("Accept", "application/json")).bodyOrThrow(PROVIDER),
                config.getRetry());
        return ProviderJson.readTree(objectMapper, PROVIDER, body);
    }

    // details report rate as text such as "3h"; the leading digit is the popularity
    static int parseRate(JsonNode rate) {
        if (rate.isNumber()) {
            return rate.asInt();
        }
        String text = rate.asText("");
        return !text.isEmpty() && Character.isDigit(text.charAt(0)) ? Character.digit(text.charAt(0), 10) : 0;
    }
}
