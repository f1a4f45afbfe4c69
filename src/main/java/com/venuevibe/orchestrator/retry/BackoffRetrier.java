package com.venuevibe.orchestrator.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Wraps one remote call with bounded exponential-backoff retry.
 *
 * <p>The delay before retry {@code i} (0-indexed) is
 * <pre>
 *   min(initialDelay * 2^i + jitter, maxDelay),  jitter uniform in [0, maxJitter)
 * </pre>
 * Jitter spreads out callers that failed together against the same outage.
 *
 * <p>Only failures the {@link RetryPolicy} allow-lists are retried. Once {@code maxAttempts}
 * invocations have failed, the last error is rethrown as is. The retrier knows nothing about
 * caching or rate limiting; adapters place it inside those checks.
 *
 * <p><b>Thread Safety:</b> stateless apart from its collaborators; one instance is shared.
 */
@Slf4j
public class BackoffRetrier {

    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;

    /**
     * @param jitterSource returns values in {@code [0, 1)}, scaled by the policy's max jitter
     */
    public BackoffRetrier(Sleeper sleeper, DoubleSupplier jitterSource) {
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    public <T> T retry(String operation, RemoteCall<T> call, RetryPolicy policy) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        long cumulativeDelay = 0;

        for (int attempt = 0; ; attempt++) {
            try {
                T result = call.call();
                if (attempt > 0) {
                    log.info("[RETRY] {} succeeded after {} attempts (waited {}ms)", operation, attempt + 1, cumulativeDelay);
                }
                return result;
            } catch (RuntimeException e) {
                boolean retryable = policy.isRetryable(e);
                boolean lastAttempt = attempt + 1 >= maxAttempts;

                if (!retryable) {
                    throw e;
                }
                if (lastAttempt) {
                    log.error("[RETRY] {} failed after {} attempts: {}", operation, maxAttempts, e.getMessage());
                    throw e;
                }

                Duration delay = computeDelay(attempt, policy);
                cumulativeDelay += delay.toMillis();
                log.warn("[RETRY] {} attempt {}/{} failed, retrying in {}ms: {}",
                        operation, attempt + 1, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    Duration computeDelay(int attempt, RetryPolicy policy) {
        long initial = policy.getInitialDelay().toMillis();
        long max = policy.getMaxDelay().toMillis();
        // 2^attempt overflows long quickly; past 2^30 the cap has long since applied
        long exponential = initial * (1L << Math.min(attempt, 30));
        if (exponential < 0 || exponential > max) {
            exponential = max;
        }
        long jitter = (long) (jitterSource.getAsDouble() * policy.getMaxJitter().toMillis());
        return Duration.ofMillis(Math.min(exponential + jitter, max));
    }
}
