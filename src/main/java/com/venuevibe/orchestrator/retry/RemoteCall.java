package com.venuevibe.orchestrator.retry;

/**
 * A single remote invocation. Failures are reported as unchecked exceptions.
 */
@FunctionalInterface
public interface RemoteCall<T> {
    T call();
}
