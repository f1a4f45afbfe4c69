package com.venuevibe.orchestrator.service;

import com.venuevibe.orchestrator.admission.SlidingWindowRateLimiter;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically drops expired cache entries and idle rate-limit windows so memory tracks
 * live state rather than history.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final List<ExpiringLruCache<?>> caches;
    private final SlidingWindowRateLimiter rateLimiter;

    @Scheduled(fixedRateString = "${app.maintenance.sweep-interval-ms:60000}",
            initialDelayString = "${app.maintenance.sweep-interval-ms:60000}")
    public void sweep() {
        int purged = 0;
        for (ExpiringLruCache<?> cache : caches) {
            purged += cache.purgeExpired();
        }
        int idle = rateLimiter.sweep();
        if (purged > 0 || idle > 0) {
            log.debug("Maintenance sweep: {} expired cache entries, {} idle rate-limit windows", purged, idle);
        }
    }
}
