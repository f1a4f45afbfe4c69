package com.venuevibe.orchestrator.client;

import com.venuevibe.orchestrator.admission.RateLimitDecision;
import com.venuevibe.orchestrator.admission.SlidingWindowRateLimiter;
import com.venuevibe.orchestrator.exception.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Outbound request budget for a metered provider, tracked in the shared rate limiter under
 * {@code provider:<name>} as a rolling window.
 */
@Slf4j
public class ProviderQuota {

    private final String provider;
    private final int limit;
    private final Duration window;
    private final SlidingWindowRateLimiter limiter;

    public ProviderQuota(String provider, int limit, Duration window, SlidingWindowRateLimiter limiter) {
        this.provider = provider;
        this.limit = limit;
        this.window = window;
        this.limiter = limiter;
    }

    /**
     * Consumes one request from the budget.
     *
     * @throws QuotaExceededException when the budget for the current window is used up
     */
    public void acquire() {
        RateLimitDecision decision = limiter.check(identifier(), limit, window);
        if (!decision.allowed()) {
            log.warn("{} quota of {} per {} reached", provider, limit, window);
            throw new QuotaExceededException(provider, decision.retryAfterSecondsOr((int) window.toSeconds()));
        }
    }

    public int used() {
        return limiter.countFor(identifier());
    }

    public int getLimit() {
        return limit;
    }

    private String identifier() {
        return "provider:" + provider;
    }
}
