package com.venuevibe.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.venuevibe.orchestrator.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with Mustache.
 *
 * Usage:
 * String prompt = promptLibrary.render("query-planner", Map.of(
 *     "occasion", "date night",
 *     "budget", "medium"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    PromptTemplate template = yamlMapper.readValue(in, PromptTemplate.class);
                    templates.put(template.getName(), template);
                    log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
                }
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Render a prompt with variables
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);

        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        Mustache mustache = compiled.computeIfAbsent(templateName, name -> mustacheFactory.compile(
                new StringReader(template.getSystemPrompt() + "\n\n" + template.getUserPrompt()), name));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
