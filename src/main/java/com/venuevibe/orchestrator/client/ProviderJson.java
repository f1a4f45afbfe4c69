package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.exception.MalformedResponseException;
import com.venuevibe.orchestrator.util.ExternalCallLogger;

/**
 * JSON helpers shared by the adapters. Parse failures are permanent: they become
 * {@link MalformedResponseException} and are never retried.
 */
final class ProviderJson {

    private ProviderJson() {
    }

    static JsonNode readTree(ObjectMapper objectMapper, String provider, String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException(provider, provider + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(provider,
                    provider + " returned invalid JSON: " + ExternalCallLogger.truncate(body, 200), e);
        }
    }

    static String write(ObjectMapper objectMapper, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    /**
     * Text of {@code node}, or {@code null} when missing, JSON null or blank.
     */
    static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
