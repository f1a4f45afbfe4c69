package com.venuevibe.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A venue as reported by one place-search provider, possibly enriched afterwards.
 *
 * <p>{@code placeId} is the provider-scoped identity ({@code osm-node-123},
 * {@code tomtom-abc}); deduplication is keyed on it. Candidates live for one search pass and
 * are never retained.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VenueCandidate {

    private String placeId;
    private String provider;
    private String name;
    private String address;
    private GeoPoint location;

    /**
     * 0 to 5, absent when no provider reported one.
     */
    private Double rating;

    /**
     * 1 ($) to 4 ($$$$).
     */
    private Integer priceLevel;

    @Builder.Default
    private List<String> photos = new ArrayList<>();

    @Builder.Default
    private List<Review> reviews = new ArrayList<>();

    private String description;
    private String wikidataId;

    @Builder.Default
    private List<String> openingHours = new ArrayList<>();

    /**
     * True when the candidate carries a rating, a photo or a review.
     */
    @JsonIgnore
    public boolean hasQualitySignal() {
        return (rating != null && rating > 0)
                || (photos != null && !photos.isEmpty())
                || (reviews != null && !reviews.isEmpty());
    }
}
