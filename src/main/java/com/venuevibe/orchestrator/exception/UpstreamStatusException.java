package com.venuevibe.orchestrator.exception;

import lombok.Getter;

/**
 * The provider answered with a non-2xx status.
 */
@Getter
public class UpstreamStatusException extends UpstreamException {

    private final int statusCode;
    private final String responseBody;

    public UpstreamStatusException(String provider, int statusCode, String responseBody) {
        super(provider, provider + " API error (" + statusCode + "): " + abbreviate(responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
