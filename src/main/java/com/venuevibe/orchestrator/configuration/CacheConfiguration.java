package com.venuevibe.orchestrator.configuration;

import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.config.CacheProperties;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import com.venuevibe.orchestrator.model.VenueCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * One cache instance per domain, sized and timed independently.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    @Bean
    public ExpiringLruCache<GeocodedLocation> geocodeCache(CacheProperties properties, Clock clock) {
        return create("geocode", properties.getGeocode(), clock);
    }

    @Bean
    public ExpiringLruCache<List<VenueCandidate>> placeSearchCache(CacheProperties properties, Clock clock) {
        return create("place-search", properties.getPlaceSearch(), clock);
    }

    private static <V> ExpiringLruCache<V> create(String name, CacheProperties.Domain domain, Clock clock) {
        log.info("✅ Cache '{}' configured: maxSize={}, ttl={}", name, domain.getMaxSize(), domain.getTtl());
        return new ExpiringLruCache<>(name, domain.getMaxSize(), domain.getTtl(), clock);
    }
}
