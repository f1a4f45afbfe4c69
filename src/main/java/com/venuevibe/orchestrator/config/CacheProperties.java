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

/**
 * Sizing and TTL for each cache domain.
 *
 * <pre>
 * app:
 *   cache:
 *     geocode:
 *       max-size: 100
 *       ttl: 24h
 *     place-search:
 *       max-size: 200
 *       ttl: 6h
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.cache")
public class CacheProperties {

    @Valid
    @NotNull
    private Domain geocode = new Domain(100, Duration.ofHours(24));

    @Valid
    @NotNull
    private Domain placeSearch = new Domain(200, Duration.ofHours(6));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Domain {

        @Min(1)
        private int maxSize;

        @NotNull
        private Duration ttl;
    }
}
