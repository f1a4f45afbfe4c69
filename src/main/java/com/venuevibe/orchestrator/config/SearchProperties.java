package com.venuevibe.orchestrator.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Orchestration knobs for a venue search pass ({@code app.search}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.search")
public class SearchProperties {

    /**
     * Place-search providers in dispatch and first-seen-wins order.
     */
    private List<String> providers = new ArrayList<>(List.of("overpass", "tomtom"));

    @Min(1)
    private int defaultRadiusMeters = 5000;

    @Min(1)
    private int maxResults = 15;

    @Min(0)
    private int enrichmentLimit = 20;

    /**
     * Below this many survivors the quality filter is skipped and the unfiltered list is used.
     */
    @Min(0)
    private int minimumFilteredResults = 5;

    /**
     * Bounded pool for providers dispatched in parallel.
     */
    private Executor executor = new Executor();

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 100;
    }
}
