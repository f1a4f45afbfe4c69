package com.venuevibe.orchestrator.exception;

import lombok.Getter;

/**
 * The request never produced an HTTP response (reset, timeout, DNS, refused...).
 */
@Getter
public class UpstreamTransportException extends UpstreamException {

    private final TransportErrorCategory category;

    public UpstreamTransportException(String provider, TransportErrorCategory category, Throwable cause) {
        super(provider, provider + " transport failure (" + category + "): " + cause.getMessage(), cause);
        this.category = category;
    }

    public static UpstreamTransportException from(String provider, Throwable cause) {
        return new UpstreamTransportException(provider, TransportErrorCategory.classify(cause), cause);
    }
}
