package com.venuevibe.orchestrator.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: query-planner
 * version: 1.0
 * temperature: 0.4
 * systemPrompt: |
 *   You are a venue search expert...
 * userPrompt: |
 *   OCCASION: {{occasion}}
 * </pre>
 *
 * @see com.venuevibe.orchestrator.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String model;
    private double temperature;
    private String systemPrompt;
    private String userPrompt;
}
