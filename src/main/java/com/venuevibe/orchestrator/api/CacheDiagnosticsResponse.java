package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.cache.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheDiagnosticsResponse {

    private List<CacheStats> caches;

    /**
     * Identifiers currently tracked by the rate limiter (clients per scope plus provider quotas).
     */
    private int rateLimiterEntries;

    private int tomtomQuotaUsed;
    private int tomtomQuotaLimit;
}
