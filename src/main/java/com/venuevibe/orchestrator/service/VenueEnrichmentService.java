package com.venuevibe.orchestrator.service;

import com.venuevibe.orchestrator.client.OpenTripMapClient;
import com.venuevibe.orchestrator.client.WikidataClient;
import com.venuevibe.orchestrator.model.VenueCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Adds descriptions, images and popularity ratings to place-search candidates.
 *
 * <p>Wikidata is queried once for the whole batch. OpenTripMap is consulted per candidate that
 * still lacks an image or a rating. Enrichment never fails a search: a candidate whose
 * lookups fail is returned as it came in. Inputs are not mutated; enriched candidates are
 * copies, because the originals may be shared with the place-search cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VenueEnrichmentService {

    private final WikidataClient wikidata;
    private final OpenTripMapClient openTripMap;

    public List<VenueCandidate> enrich(List<VenueCandidate> candidates) {
        if (candidates.isEmpty()) {
            return candidates;
        }

        Map<String, WikidataClient.Entry> wiki = wikidata.fetchEntities(candidates.stream()
                .map(VenueCandidate::getWikidataId)
                .filter(Objects::nonNull)
                .toList());

        List<VenueCandidate> enriched = new ArrayList<>(candidates.size());
        for (VenueCandidate candidate : candidates) {
            try {
                enriched.add(enrichOne(candidate, wiki));
            } catch (RuntimeException e) {
                log.warn("Enrichment failed for {}, keeping it unenriched: {}", candidate.getPlaceId(), e.getMessage());
                enriched.add(candidate);
            }
        }
        log.debug("Enriched {} candidates ({} Wikidata entries)", enriched.size(), wiki.size());
        return enriched;
    }

    private VenueCandidate enrichOne(VenueCandidate candidate, Map<String, WikidataClient.Entry> wiki) {
        String imageUrl = null;
        String description = candidate.getDescription();
        Double rating = candidate.getRating();

        WikidataClient.Entry entry = candidate.getWikidataId() != null ? wiki.get(candidate.getWikidataId()) : null;
        if (entry != null) {
            imageUrl = entry.imageUrl();
            if (description == null) {
                description = entry.description();
            }
        }

        List<String> existingPhotos = candidate.getPhotos() != null ? candidate.getPhotos() : List.of();
        boolean hasImage = imageUrl != null || !existingPhotos.isEmpty();
        if ((!hasImage || rating == null) && openTripMap.isEnabled()) {
            Optional<OpenTripMapClient.Place> place = openTripMap.lookup(candidate.getName(), candidate.getLocation());
            if (place.isPresent()) {
                if (!hasImage) {
                    imageUrl = place.get().imageUrl();
                }
                if (description == null) {
                    description = place.get().text();
                }
                if (rating == null) {
                    rating = place.get().rating().orElse(null);
                }
            }
        }

        if (imageUrl == null && Objects.equals(description, candidate.getDescription())
                && Objects.equals(rating, candidate.getRating())) {
            return candidate;
        }

        List<String> photos = new ArrayList<>(existingPhotos);
        if (imageUrl != null && !photos.contains(imageUrl)) {
            photos.add(0, imageUrl);
        }
        return candidate.toBuilder()
                .photos(photos)
                .description(description)
                .rating(rating)
                .build();
    }
}
