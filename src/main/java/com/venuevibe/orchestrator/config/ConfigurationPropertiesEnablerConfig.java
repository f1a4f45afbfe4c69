package com.venuevibe.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers every {@code app.*} properties class with Spring's binder.
 *
 * <ul>
 *   <li>{@link CacheProperties} - cache domains
 *   <li>{@link RateLimitProperties} - inbound admission limits
 *   <li>{@link ProviderProperties} - upstream endpoints, keys and retry policies
 *   <li>{@link SearchProperties} - orchestration limits
 *   <li>{@link HttpProperties} - outbound transport
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    CacheProperties.class,
    RateLimitProperties.class,
    ProviderProperties.class,
    SearchProperties.class,
    HttpProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
