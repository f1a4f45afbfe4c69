package com.venuevibe.orchestrator.model;

/**
 * External services the orchestrator talks to, for unified call logging.
 *
 * @see com.venuevibe.orchestrator.util.ExternalCallLogger
 */
public enum ServiceType {
    NOMINATIM("🟢", "Nominatim"),
    OVERPASS("🗺️", "Overpass"),
    TOMTOM("🔴", "TomTom"),
    WIKIDATA("📚", "Wikidata"),
    OPENTRIPMAP("🧭", "OpenTripMap"),
    OPENROUTER("🤖", "OpenRouter");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
