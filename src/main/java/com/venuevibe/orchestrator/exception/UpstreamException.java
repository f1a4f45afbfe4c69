package com.venuevibe.orchestrator.exception;

import lombok.Getter;

/**
 * Base type of every failure raised while talking to an upstream provider.
 */
@Getter
public abstract class UpstreamException extends RuntimeException {

    private final String provider;

    protected UpstreamException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    protected UpstreamException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
