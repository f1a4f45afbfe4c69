package com.venuevibe.orchestrator.retry;

import java.time.Duration;

/**
 * Blocking pause used between retries and throttled calls; swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
