package com.venuevibe.orchestrator.exception;

import lombok.Getter;

@Getter
public class LocationNotFoundException extends RuntimeException {

    private final String location;

    public LocationNotFoundException(String location) {
        super("Location \"" + location + "\" not found. Please try a more specific address or city name.");
        this.location = location;
    }
}
