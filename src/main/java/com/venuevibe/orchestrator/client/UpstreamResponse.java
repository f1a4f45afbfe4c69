package com.venuevibe.orchestrator.client;

import com.venuevibe.orchestrator.exception.UpstreamStatusException;

/**
 * Status and raw body of one upstream HTTP exchange.
 */
public record UpstreamResponse(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * @return the body of a 2xx response
     * @throws UpstreamStatusException for any other status
     */
    public String bodyOrThrow(String provider) {
        if (!isSuccess()) {
            throw new UpstreamStatusException(provider, status, body);
        }
        return body;
    }
}
