package com.venuevibe.orchestrator.retry;

import com.venuevibe.orchestrator.exception.TransportErrorCategory;
import com.venuevibe.orchestrator.exception.UpstreamStatusException;
import com.venuevibe.orchestrator.exception.UpstreamTransportException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Retry behaviour for one provider adapter.
 *
 * <p>Bound from {@code app.providers.<name>.retry}:
 * <pre>
 * retry:
 *   max-attempts: 3
 *   initial-delay: 1s
 *   max-delay: 10s
 *   retryable-status-codes: [429, 500, 502, 503, 504]
 *   retryable-errors: [CONNECTION_RESET, TIMEOUT, DNS_FAILURE, CONNECTION_REFUSED]
 * </pre>
 *
 * <p>The retryable conditions are an allow-list. Anything not named here, including every
 * 4xx other than those listed, fails on the first attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Total invocations including the first one.
     */
    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(10);

    /**
     * Upper bound of the random jitter added to each delay.
     */
    @Builder.Default
    private Duration maxJitter = Duration.ofMillis(100);

    @Builder.Default
    private List<Integer> retryableStatusCodes = new ArrayList<>(List.of(429, 500, 502, 503, 504));

    @Builder.Default
    private Set<TransportErrorCategory> retryableErrors = EnumSet.of(
            TransportErrorCategory.CONNECTION_RESET,
            TransportErrorCategory.TIMEOUT,
            TransportErrorCategory.DNS_FAILURE,
            TransportErrorCategory.CONNECTION_REFUSED);

    public boolean isRetryable(Throwable error) {
        if (error instanceof UpstreamStatusException statusError) {
            return retryableStatusCodes != null && retryableStatusCodes.contains(statusError.getStatusCode());
        }
        if (error instanceof UpstreamTransportException transportError) {
            return retryableErrors != null && retryableErrors.contains(transportError.getCategory());
        }
        return false;
    }

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }
}
