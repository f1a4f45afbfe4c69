package com.venuevibe.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Transport settings shared by every outbound provider call ({@code app.http}).
 */
@Data
@ConfigurationProperties(prefix = "app.http")
public class HttpProperties {

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Upper bound for a whole response. Overpass queries carry their own 15 s server-side
     * timeout, so keep this above it.
     */
    private Duration responseTimeout = Duration.ofSeconds(20);

    private int maxInMemorySizeBytes = 4 * 1024 * 1024;
}
