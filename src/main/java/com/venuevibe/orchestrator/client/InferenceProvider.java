package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Chat-completion backend used for query planning and venue ranking.
 */
public interface InferenceProvider {

    /**
     * @param prompt    the full prompt text
     * @param operation name of the calling feature, for logging
     * @return the model's reply text, never blank
     */
    String chat(String prompt, String operation);

    /**
     * Like {@link #chat} but parses the reply as JSON, tolerating Markdown code fences around it.
     */
    <T> T chatJson(String prompt, String operation, TypeReference<T> type);

    String getProviderName();
}
