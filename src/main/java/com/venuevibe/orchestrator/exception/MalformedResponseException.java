package com.venuevibe.orchestrator.exception;

/**
 * The provider answered 2xx but the body could not be understood. Never retried.
 */
public class MalformedResponseException extends UpstreamException {

    public MalformedResponseException(String provider, String message) {
        super(provider, message);
    }

    public MalformedResponseException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
