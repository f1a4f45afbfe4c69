package com.venuevibe.orchestrator.admission;

import java.time.Instant;

/**
 * Outcome of one sliding-window admission check.
 *
 * @param limit              the limit the check was made against
 * @param remaining          admissions left in the current window after this check
 * @param resetAt            when the oldest counted request leaves the window
 * @param retryAfterSeconds  only set when denied
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, Instant resetAt, Integer retryAfterSeconds) {

    /**
     * Seconds a denied caller should wait, or {@code fallback} when the decision carries none.
     */
    public int retryAfterSecondsOr(int fallback) {
        return retryAfterSeconds != null ? retryAfterSeconds : fallback;
    }
}
