package com.venuevibe.orchestrator.exception;

import lombok.Getter;

/**
 * A provider quota (local daily cap or the upstream's own) is used up; try again later.
 */
@Getter
public class QuotaExceededException extends UpstreamException {

    private final int retryAfterSeconds;

    public QuotaExceededException(String provider, int retryAfterSeconds) {
        super(provider, provider + " quota exhausted, retry after " + retryAfterSeconds + "s");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
