package com.venuevibe.orchestrator.config;

import com.venuevibe.orchestrator.retry.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Endpoints, credentials and retry behaviour for every upstream provider.
 *
 * <p>Properties are loaded from the {@code app.providers} namespace:
 * <pre>
 * app:
 *   providers:
 *     tomtom:
 *       enabled: true
 *       api-key: ${TOMTOM_API_KEY:}
 *       daily-quota: 2500
 *       retry:
 *         max-attempts: 3
 *         initial-delay: 1s
 *     openrouter:
 *       api-key: ${OPENROUTER_API_KEY:}
 *       model: google/gemini-2.5-flash-lite-preview-09-2025
 * </pre>
 *
 * <p>API keys come from environment variables and are never logged.
 */
@Data
@ConfigurationProperties(prefix = "app.providers")
public class ProviderProperties {

    private Nominatim nominatim = new Nominatim();
    private Overpass overpass = new Overpass();
    private TomTom tomtom = new TomTom();
    private Wikidata wikidata = new Wikidata();
    private OpenTripMap opentripmap = new OpenTripMap();
    private OpenRouter openrouter = new OpenRouter();

    @Data
    public static class Nominatim {
        private String baseUrl = "https://nominatim.openstreetmap.org";

        /**
         * Required by the Nominatim usage policy.
         */
        private String userAgent = "VenueVibe/1.0 (https://venuevibe.app)";

        /**
         * Minimum gap between two outbound requests (usage policy: one per second).
         */
        private Duration minInterval = Duration.ofSeconds(1);

        private RetryPolicy retry = RetryPolicy.defaults();
    }

    @Data
    public static class Overpass {
        private boolean enabled = true;

        /**
         * Tried in order; the next one is used when a server fails.
         */
        private List<String> servers = new ArrayList<>(List.of(
                "https://overpass.kumi.systems/api/interpreter",
                "https://overpass-api.de/api/interpreter"));

        private int maxRadiusMeters = 5000;
        private int resultLimit = 20;
        private int queryTimeoutSeconds = 15;

        /**
         * Pause between consecutive queries of one search pass.
         */
        private Duration queryDelay = Duration.ofMillis(500);

        private RetryPolicy retry = RetryPolicy.defaults();
    }

    @Data
    public static class TomTom {
        private boolean enabled = false;
        private String apiKey;
        private String baseUrl = "https://api.tomtom.com";
        private int dailyQuota = 2500;
        private Duration quotaWindow = Duration.ofHours(24);
        private int maxRadiusMeters = 100_000;
        private int resultLimit = 20;
        private int maxResultLimit = 100;
        private boolean fetchDetails = true;
        private int maxPhotos = 5;
        private int maxReviews = 5;
        private RetryPolicy retry = RetryPolicy.defaults();
    }

    @Data
    public static class Wikidata {
        private String baseUrl = "https://www.wikidata.org";
        private int batchSize = 50;
        private int imageWidth = 600;
        private RetryPolicy retry = RetryPolicy.defaults();
    }

    @Data
    public static class OpenTripMap {
        /**
         * Optional. Without a key the enrichment step is skipped.
         */
        private String apiKey;
        private String baseUrl = "https://api.opentripmap.com/0.1/en";
        private int searchRadiusMeters = 200;
        private RetryPolicy retry = RetryPolicy.defaults();
    }

    @Data
    public static class OpenRouter {
        private String apiKey;
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String model = "google/gemini-2.5-flash-lite-preview-09-2025";
        private String referer = "http://localhost:3000";
        private String title = "VenueVibe";
        private RetryPolicy retry = RetryPolicy.defaults();
    }
}
