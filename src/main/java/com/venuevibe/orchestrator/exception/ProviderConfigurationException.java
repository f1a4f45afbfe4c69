package com.venuevibe.orchestrator.exception;

import lombok.Getter;

/**
 * Fatal misconfiguration such as a missing API key. Unlike other upstream failures this is
 * never absorbed: it reaches the caller as a user-visible error.
 */
@Getter
public class ProviderConfigurationException extends RuntimeException {

    private final String provider;

    public ProviderConfigurationException(String provider, String message) {
        super(message);
        this.provider = provider;
    }
}
