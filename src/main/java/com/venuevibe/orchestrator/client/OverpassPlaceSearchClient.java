package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.cache.CacheKeys;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.TransportErrorCategory;
import com.venuevibe.orchestrator.exception.UpstreamException;
import com.venuevibe.orchestrator.exception.UpstreamTransportException;
import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.ServiceType;
import com.venuevibe.orchestrator.model.VenueCandidate;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * OpenStreetMap venue search through the Overpass API.
 *
 * <p>Free text is mapped onto OSM tag selectors; there is no full-text search. Public Overpass
 * instances time out under load, so queries are capped at 5 km and sent one at a time, and
 * each configured server is tried in order until one answers.
 */
@Slf4j
@Component
public class OverpassPlaceSearchClient implements PlaceSearchProvider {

    static final String PROVIDER = "overpass";
    static final String ADDRESS_NOT_AVAILABLE = "Address not available";

    private final UpstreamHttpClient http;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;
    private final ProviderProperties.Overpass config;
    private final ExpiringLruCache<List<VenueCandidate>> cache;

    public OverpassPlaceSearchClient(UpstreamHttpClient http,
                                     BackoffRetrier retrier,
                                     ObjectMapper objectMapper,
                                     ProviderProperties properties,
                                     @Qualifier("placeSearchCache") ExpiringLruCache<List<VenueCandidate>> cache) {
        this.http = http;
        this.retrier = retrier;
        this.objectMapper = objectMapper;
        this.config = properties.getOverpass();
        this.cache = cache;
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
        return DispatchPolicy.sequential(config.getQueryDelay());
    }

    @Override
    public List<VenueCandidate> search(String query, GeoPoint location, int radiusMeters) {
        int radius = Math.min(radiusMeters, config.getMaxRadiusMeters());
        String key = CacheKeys.placeSearch(PROVIDER, query, location.lat(), location.lng(), radius);
        Optional<List<VenueCandidate>> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Overpass cache hit for '{}'", query);
            return cached.get();
        }

        String ql = buildQuery(query, location, radius, config.getQueryTimeoutSeconds(), config.getResultLimit());
        String form = "data=" + URLEncoder.encode(ql, StandardCharsets.UTF_8);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OVERPASS, "search", log);
        ctx.logRequest(query, "radius", radius, "selector", selectorFor(query));

        UpstreamException lastError = null;
        for (String server : config.getServers()) {
            try {
                String body = retrier.retry("overpass.interpreter", () -> http.post(PROVIDER, URI.create(server),
                                Map.of("Accept", "application/json"),
                                MediaType.APPLICATION_FORM_URLENCODED_VALUE, form)
                        .bodyOrThrow(PROVIDER),
                        config.getRetry());
                List<VenueCandidate> venues = List.copyOf(parse(ProviderJson.readTree(objectMapper, PROVIDER, body)));
                cache.set(key, venues);
                ctx.logResponse(venues.size() + " venues from " + server);
                return venues;
            } catch (UpstreamException e) {
                log.warn("Overpass server {} failed, trying next: {}", server, e.getMessage());
                lastError = e;
            }
        }

        UpstreamException failure = lastError != null
                ? lastError
                : new UpstreamTransportException(PROVIDER, TransportErrorCategory.OTHER,
                        new IOException("No Overpass servers configured"));
        ctx.logError("All Overpass servers failed", failure);
        throw failure;
    }

    /**
     * Builds the Overpass QL for one query: nodes and ways matching the selector within
     * {@code radius} metres, with ways reduced to their centre point.
     */
    static String buildQuery(String query, GeoPoint location, int radius, int timeoutSeconds, int limit) {
        String selector = selectorFor(query);
        String around = String.format(Locale.ROOT, "(around:%d,%.6f,%.6f)", radius, location.lat(), location.lng());
        return "[out:json][timeout:" + timeoutSeconds + "];\n"
                + "(\n"
                + "  node" + selector + around + ";\n"
                + "  way" + selector + around + ";\n"
                + ");\n"
                + "out center " + limit + ";";
    }

    static String selectorFor(String query) {
        return tagFilterFor(query) + cuisineFilterFor(query);
    }

    static String tagFilterFor(String query) {
        String q = query.toLowerCase(Locale.ROOT);
        if (q.contains("restaurant") || q.contains("dining")) {
            return "[\"amenity\"=\"restaurant\"]";
        }
        if (q.contains("bar") || q.contains("pub")) {
            return "[\"amenity\"~\"bar|pub\"]";
        }
        if (q.contains("cafe") || q.contains("coffee")) {
            return "[\"amenity\"=\"cafe\"]";
        }
        if (q.contains("museum")) {
            return "[\"tourism\"=\"museum\"]";
        }
        if (q.contains("park")) {
            return "[\"leisure\"=\"park\"]";
        }
        if (q.contains("cinema") || q.contains("movie")) {
            return "[\"amenity\"=\"cinema\"]";
        }
        if (q.contains("theater") || q.contains("theatre")) {
            return "[\"amenity\"=\"theatre\"]";
        }
        return "[\"amenity\"~\"restaurant|bar|cafe|pub\"]";
    }

    // later matches win, so "pizza burger" filters on burger
    static String cuisineFilterFor(String query) {
        String q = query.toLowerCase(Locale.ROOT);
        String cuisine = null;
        for (String candidate : List.of("italian", "mexican", "chinese", "pizza", "burger")) {
            if (q.contains(candidate)) {
                cuisine = candidate;
            }
        }
        return cuisine != null ? "[\"cuisine\"~\"" + cuisine + "\"]" : "";
    }

    List<VenueCandidate> parse(JsonNode root) {
        List<VenueCandidate> venues = new ArrayList<>();
        for (JsonNode element : root.path("elements")) {
            JsonNode tags = element.path("tags");
            String name = ProviderJson.text(tags.path("name"));
            if (name == null) {
                continue;
            }
            JsonNode point = element.has("lat") ? element : element.path("center");
            if (!point.path("lat").isNumber() || !point.path("lon").isNumber()) {
                continue;
            }

            venues.add(VenueCandidate.builder()
                    .placeId("osm-" + element.path("type").asText() + "-" + element.path("id").asText())
                    .provider(PROVIDER)
                    .name(name)
                    .address(formatAddress(tags))
                    .location(new GeoPoint(point.path("lat").asDouble(), point.path("lon").asDouble()))
                    .wikidataId(ProviderJson.text(tags.path("wikidata")))
                    .openingHours(openingHoursOf(tags))
                    .build());
        }
        return venues;
    }

    private static List<String> openingHoursOf(JsonNode tags) {
        String hours = ProviderJson.text(tags.path("opening_hours"));
        return hours != null ? new ArrayList<>(List.of(hours)) : new ArrayList<>();
    }

    static String formatAddress(JsonNode tags) {
        String number = Optional.ofNullable(ProviderJson.text(tags.path("addr:housenumber"))).orElse("");
        String street = Optional.ofNullable(ProviderJson.text(tags.path("addr:street"))).orElse("");
        String city = ProviderJson.text(tags.path("addr:city"));

        StringJoiner address = new StringJoiner(", ");
        String streetLine = (number + " " + street).trim();
        if (!streetLine.isEmpty()) {
            address.add(streetLine);
        }
        if (city != null) {
            address.add(city);
        }
        return address.length() > 0 ? address.toString() : ADDRESS_NOT_AVAILABLE;
    }
}
