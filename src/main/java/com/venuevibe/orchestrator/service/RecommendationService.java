package com.venuevibe.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.venuevibe.orchestrator.client.InferenceProvider;
import com.venuevibe.orchestrator.model.Budget;
import com.venuevibe.orchestrator.model.RecommendedVenue;
import com.venuevibe.orchestrator.model.VenueCandidate;
import com.venuevibe.orchestrator.model.VenuePreferences;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranks candidate venues for an occasion with the inference provider.
 *
 * <p>Answers are matched back to venues by case-insensitive name. If fewer than five match,
 * unmatched venues are added with a neutral score of 50. Any failure degrades to the input
 * order with scores 100, 90, 80...
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    static final int TOP_N = 5;
    static final int UNMATCHED_SCORE = 50;

    private final InferenceProvider inference;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Ranking(String venueName, Integer matchScore, String aiReasoning, List<String> pros, List<String> cons) {
    }

    public List<RecommendedVenue> recommend(List<VenueCandidate> venues, VenuePreferences preferences) {
        if (venues == null || venues.isEmpty()) {
            return List.of();
        }
        VenuePreferences prefs = preferences != null ? preferences : new VenuePreferences();
        try {
            String prompt = promptLibrary.render("venue-ranking", variables(venues, prefs));
            List<Ranking> rankings = inference.chatJson(prompt, "rank-venues", new TypeReference<List<Ranking>>() {
            });
            if (rankings == null || rankings.isEmpty()) {
                log.warn("Inference returned no rankings, using fallback order");
                return fallback(venues);
            }
            return merge(venues, rankings);
        } catch (RuntimeException e) {
            log.warn("Venue ranking failed, using fallback order: {}", e.getMessage());
            return fallback(venues);
        }
    }

    List<RecommendedVenue> merge(List<VenueCandidate> venues, List<Ranking> rankings) {
        Map<String, VenueCandidate> byName = new LinkedHashMap<>();
        for (VenueCandidate venue : venues) {
            byName.putIfAbsent(normalize(venue.getName()), venue);
        }

        List<RecommendedVenue> recommended = new ArrayList<>();
        Map<String, Boolean> used = new HashMap<>();
        for (Ranking ranking : rankings) {
            if (ranking == null || ranking.venueName() == null) {
                continue;
            }
            String key = normalize(ranking.venueName());
            VenueCandidate venue = byName.get(key);
            if (venue == null || used.putIfAbsent(key, Boolean.TRUE) != null) {
                continue;
            }
            recommended.add(RecommendedVenue.builder()
                    .venue(venue)
                    .matchScore(clampScore(ranking.matchScore()))
                    .aiReasoning(ranking.aiReasoning())
                    .pros(ranking.pros() != null ? ranking.pros() : List.of())
                    .cons(ranking.cons() != null ? ranking.cons() : List.of())
                    .build());
        }

        for (Map.Entry<String, VenueCandidate> entry : byName.entrySet()) {
            if (recommended.size() >= TOP_N) {
                break;
            }
            if (used.containsKey(entry.getKey())) {
                continue;
            }
            VenueCandidate venue = entry.getValue();
            recommended.add(RecommendedVenue.builder()
                    .venue(venue)
                    .matchScore(UNMATCHED_SCORE)
                    .aiReasoning("This venue matches your search criteria and is located in your desired area.")
                    .pros(List.of(describeRating(venue)))
                    .cons(List.of("Limited matching data"))
                    .build());
        }

        return recommended.stream()
                .sorted(Comparator.comparingInt(RecommendedVenue::getMatchScore).reversed())
                .limit(TOP_N)
                .toList();
    }

    List<RecommendedVenue> fallback(List<VenueCandidate> venues) {
        List<RecommendedVenue> result = new ArrayList<>();
        for (int i = 0; i < Math.min(TOP_N, venues.size()); i++) {
            VenueCandidate venue = venues.get(i);
            boolean highlyRated = venue.getRating() != null && venue.getRating() >= 4;
            boolean hasReviews = venue.getReviews() != null && !venue.getReviews().isEmpty();
            result.add(RecommendedVenue.builder()
                    .venue(venue)
                    .matchScore(Math.max(0, 100 - i * 10))
                    .aiReasoning(venue.getRating() != null
                            ? "This venue has a " + venue.getRating() + " star rating and is available in your search area."
                            : "This venue is available in your search area.")
                    .pros(highlyRated ? List.of("Highly rated", "Good reviews") : List.of("Available in your area"))
                    .cons(hasReviews ? List.of() : List.of("Limited review data"))
                    .build());
        }
        return result;
    }

    private Map<String, Object> variables(List<VenueCandidate> venues, VenuePreferences prefs) {
        List<Map<String, Object>> summary = venues.stream().map(v -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", v.getName());
            item.put("address", v.getAddress());
            item.put("rating", v.getRating());
            item.put("priceLevel", v.getPriceLevel());
            item.put("reviewCount", v.getReviews() != null ? v.getReviews().size() : 0);
            item.put("topReview", v.getReviews() != null && !v.getReviews().isEmpty()
                    ? v.getReviews().get(0).getText()
                    : "No reviews available");
            return item;
        }).toList();

        Map<String, Object> vars = new HashMap<>();
        vars.put("occasion", prefs.getOccasion() != null ? prefs.getOccasion() : "not specified");
        vars.put("budget", (prefs.getBudget() != null ? prefs.getBudget() : Budget.ANY).value());
        vars.put("groupSize", prefs.getGroupSize() != null ? prefs.getGroupSize().toString() : "not specified");
        vars.put("dietaryRestrictions", prefs.getDietaryRestrictions() != null && !prefs.getDietaryRestrictions().isEmpty()
                ? String.join(", ", prefs.getDietaryRestrictions())
                : "none");
        vars.put("atmosphere", prefs.getAtmosphere() != null ? prefs.getAtmosphere() : "any");
        vars.put("additionalPreferences", prefs.getAdditionalPreferences() != null ? prefs.getAdditionalPreferences() : "none");
        vars.put("venuesJson", toPrettyJson(summary));
        return vars;
    }

    private String toPrettyJson(Object value) {
        try {
            return objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize venues for ranking", e);
        }
    }

    private static String describeRating(VenueCandidate venue) {
        return venue.getRating() != null ? venue.getRating() + " star rating" : "Located in your search area";
    }

    private static int clampScore(Integer score) {
        if (score == null) {
            return UNMATCHED_SCORE;
        }
        return Math.max(0, Math.min(100, score));
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
