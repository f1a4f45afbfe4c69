package com.venuevibe.orchestrator.client;

import java.time.Duration;

/**
 * How the orchestrator fans a provider's queries out within one search pass.
 */
public record DispatchPolicy(Mode mode, Duration interQueryDelay) {

    public enum Mode {
        /** One query at a time on the calling thread, pausing between queries. */
        SEQUENTIAL,
        /** All queries at once on the bounded provider executor. */
        PARALLEL
    }

    public static DispatchPolicy sequential(Duration delay) {
        return new DispatchPolicy(Mode.SEQUENTIAL, delay);
    }

    public static DispatchPolicy parallel() {
        return new DispatchPolicy(Mode.PARALLEL, Duration.ZERO);
    }
}
