package com.venuevibe.orchestrator.exception;

import lombok.Getter;

/**
 * Client input rejected before any work is done. {@code code} is the machine-readable reason
 * returned in the error body (e.g. {@code MISSING_LOCATION}).
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    private final String code;

    public InvalidRequestException(String code, String message) {
        super(message);
        this.code = code;
    }
}
