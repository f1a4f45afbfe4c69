package com.venuevibe.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound admission limits.
 *
 * <p>Properties are loaded from the {@code app.rate-limit} namespace in application.yml:
 * <pre>
 * app:
 *   rate-limit:
 *     global:
 *       limit: 30
 *       window: 60s
 *     routes:
 *       search:
 *         path: /api/v1/venues/search
 *         limit: 10
 *         window: 60s
 * </pre>
 *
 * <p>The global gate applies to every request under {@code /api/**}; a route gate applies on
 * top of it to requests whose path starts with the route's {@code path}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;

    @Valid
    @NotNull
    private Limit global = new Limit(null, 30, Duration.ofMinutes(1));

    @Valid
    private Map<String, Limit> routes = new LinkedHashMap<>();

    /**
     * Fallback Retry-After in seconds when a denial carries no explicit value.
     */
    private int defaultRetryAfterSeconds = 60;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Limit {

        /**
         * Path prefix this limit applies to. Ignored for the global limit.
         */
        private String path;

        @Min(1)
        private int limit;

        @NotNull
        private Duration window;
    }
}
