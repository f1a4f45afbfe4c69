package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.MalformedResponseException;
import com.venuevibe.orchestrator.exception.ProviderConfigurationException;
import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.ServiceType;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenRouter chat completions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenRouterClient implements InferenceProvider {

    static final String PROVIDER = "openrouter";
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*\\n?([\\s\\S]*?)\\n?```");

    private final UpstreamHttpClient http;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;
    private final ProviderProperties properties;

    @Override
    public String chat(String prompt, String operation) {
        ProviderProperties.OpenRouter config = properties.getOpenrouter();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new ProviderConfigurationException(PROVIDER,
                    "OPENROUTER_API_KEY is not set. Get a free API key at https://openrouter.ai/keys");
        }

        Map<String, Object> request = Map.of(
                "model", config.getModel(),
                "messages", List.of(Map.of("role", "user", "content", prompt)));
        String payload = ProviderJson.write(objectMapper, request);
        Map<String, String> headers = Map.of(
                "Authorization", "Bearer " + config.getApiKey(),
                "HTTP-Referer", config.getReferer(),
                "X-Title", config.getTitle(),
                "Accept", "application/json");
        URI uri = URI.create(config.getBaseUrl() + "/chat/completions");

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OPENROUTER, operation, log);
        ctx.logRequest(ExternalCallLogger.truncate(prompt, 200), "model", config.getModel());
        try {
            String body = retrier.retry("openrouter." + operation,
                    () -> http.post(PROVIDER, uri, headers, MediaType.APPLICATION_JSON_VALUE, payload).bodyOrThrow(PROVIDER),
                    config.getRetry());
            String content = ProviderJson.text(ProviderJson.readTree(objectMapper, PROVIDER, body)
                    .path("choices").path(0).path("message").path("content"));
            if (content == null) {
                throw new MalformedResponseException(PROVIDER, "OpenRouter returned an empty response");
            }
            ctx.logResponse(ExternalCallLogger.truncate(content, 200));
            return content;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public <T> T chatJson(String prompt, String operation, TypeReference<T> type) {
        String reply = chat(prompt, operation);
        try {
            return objectMapper.readValue(extractJson(reply), type);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(PROVIDER,
                    "Failed to parse OpenRouter response as JSON: " + ExternalCallLogger.truncate(reply, 200), e);
        }
    }

    @Override
    public String getProviderName() {
        return PROVIDER;
    }

    static String extractJson(String reply) {
        Matcher fenced = CODE_FENCE.matcher(reply);
        return (fenced.find() ? fenced.group(1) : reply).trim();
    }
}
