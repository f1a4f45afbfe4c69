package com.venuevibe.orchestrator.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.venuevibe.orchestrator.client.InferenceProvider;
import com.venuevibe.orchestrator.model.Budget;
import com.venuevibe.orchestrator.model.VenuePreferences;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an occasion and preferences into 3 to 5 OSM-style search terms.
 *
 * <p>Planning is advisory: if inference is unavailable, misconfigured or answers with anything
 * other than a non-empty list of strings, the fixed fallback terms are used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPlannerService {

    static final List<String> FALLBACK_QUERIES = List.of("restaurant", "bar", "cafe");
    static final int MAX_QUERIES = 5;

    private final InferenceProvider inference;
    private final PromptLibraryService promptLibrary;

    public List<String> plan(VenuePreferences preferences) {
        VenuePreferences prefs = preferences != null ? preferences : new VenuePreferences();
        try {
            String prompt = promptLibrary.render("query-planner", variables(prefs));
            List<String> answer = inference.chatJson(prompt, "plan-queries", new TypeReference<List<String>>() {
            });
            List<String> queries = answer == null ? List.of() : answer.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(q -> !q.isEmpty())
                    .distinct()
                    .limit(MAX_QUERIES)
                    .toList();
            if (queries.isEmpty()) {
                log.warn("Inference returned no usable search queries, using fallback");
                return FALLBACK_QUERIES;
            }
            log.info("Planned queries for '{}': {}", prefs.getOccasion(), queries);
            return queries;
        } catch (RuntimeException e) {
            log.warn("Query planning failed, using fallback: {}", e.getMessage());
            return FALLBACK_QUERIES;
        }
    }

    private static Map<String, Object> variables(VenuePreferences prefs) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("occasion", prefs.getOccasion() != null ? prefs.getOccasion() : "casual outing");
        vars.put("budget", (prefs.getBudget() != null ? prefs.getBudget() : Budget.ANY).value());
        vars.put("groupSize", prefs.getGroupSize() != null ? prefs.getGroupSize().toString() : "not specified");
        if (prefs.getDietaryRestrictions() != null && !prefs.getDietaryRestrictions().isEmpty()) {
            vars.put("dietaryRestrictions", String.join(", ", prefs.getDietaryRestrictions()));
        }
        if (prefs.getAtmosphere() != null && !prefs.getAtmosphere().isBlank()) {
            vars.put("atmosphere", prefs.getAtmosphere());
        }
        if (prefs.getAdditionalPreferences() != null && !prefs.getAdditionalPreferences().isBlank()) {
            vars.put("additionalPreferences", prefs.getAdditionalPreferences());
        }
        return vars;
    }
}
