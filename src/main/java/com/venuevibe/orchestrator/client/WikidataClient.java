package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.UpstreamException;
import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.ServiceType;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptions and images for OSM venues that carry a {@code wikidata} tag.
 *
 * <p>One {@code wbgetentities} call covers up to 50 ids. Images come from the P18 claim and are
 * returned as Commons {@code Special:FilePath} URLs, which redirect to a resized file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WikidataClient {

    static final String PROVIDER = "wikidata";
    static final String COMMONS_FILE_PATH = "https://commons.wikimedia.org/wiki/Special:FilePath/";

    private final UpstreamHttpClient http;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;
    private final ProviderProperties properties;

    public record Entry(String description, String imageUrl) {
    }

    /**
     * @return entries keyed by Wikidata id; ids Wikidata does not know are absent, and any
     *         upstream failure yields an empty map
     */
    public Map<String, Entry> fetchEntities(Collection<String> ids) {
        ProviderProperties.Wikidata config = properties.getWikidata();
        List<String> batch = ids.stream()
                .filter(Objects::nonNull)
                .distinct()
                .limit(config.getBatchSize())
                .toList();
        if (batch.isEmpty()) {
            return Map.of();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/w/api.php")
                .queryParam("action", "wbgetentities")
                .queryParam("ids", String.join("|", batch))
                .queryParam("format", "json")
                .queryParam("props", "labels|descriptions|claims")
                .queryParam("languages", "en")
                .build()
                .encode()
                .toUri();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.WIKIDATA, "wbgetentities", log);
        ctx.logRequest(batch.size() + " ids");
        try {
            String body = retrier.retry("wikidata.wbgetentities",
                    () -> http.get(PROVIDER, uri, Map.of("Accept", "application/json")).bodyOrThrow(PROVIDER),
                    config.getRetry());
            JsonNode entities = ProviderJson.readTree(objectMapper, PROVIDER, body).path("entities");

            Map<String, Entry> results = new LinkedHashMap<>();
            for (String id : batch) {
                JsonNode entity = entities.path(id);
                if (entity.isMissingNode() || entity.has("missing")) {
                    continue;
                }
                String description = ProviderJson.text(entity.path("descriptions").path("en").path("value"));
                String filename = ProviderJson.text(
                        entity.path("claims").path("P18").path(0).path("mainsnak").path("datavalue").path("value"));
                results.put(id, new Entry(description, filename != null ? imageUrl(filename, config.getImageWidth()) : null));
            }
            ctx.logResponse(results.size() + " entities");
            return results;
        } catch (UpstreamException e) {
            ctx.logError(e.getMessage(), e);
            return Map.of();
        }
    }

    static String imageUrl(String filename, int width) {
        String safe = filename.replace(' ', '_');
        return COMMONS_FILE_PATH + UriUtils.encodePathSegment(safe, StandardCharsets.UTF_8) + "?width=" + width;
    }
}
