package com.venuevibe.orchestrator.api;

import com.venuevibe.orchestrator.admission.SlidingWindowRateLimiter;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.client.ProviderQuota;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/diagnostics/caches
 */
@RestController
@RequestMapping("/api/v1/diagnostics")
@RequiredArgsConstructor
public class DiagnosticsController {

    private final List<ExpiringLruCache<?>> caches;
    private final SlidingWindowRateLimiter rateLimiter;

    private final ProviderQuota tomtomQuota;

    @GetMapping("/caches")
    public ResponseEntity<CacheDiagnosticsResponse> caches() {
        return ResponseEntity.ok(CacheDiagnosticsResponse.builder()
                .caches(caches.stream().map(ExpiringLruCache::stats).toList())
                .rateLimiterEntries(rateLimiter.size())
                .tomtomQuotaUsed(tomtomQuota.used())
                .tomtomQuotaLimit(tomtomQuota.getLimit())
                .build());
    }
}
