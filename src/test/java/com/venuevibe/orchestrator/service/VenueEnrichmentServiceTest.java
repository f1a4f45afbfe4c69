package com.venuevibe.orchestrator.service;

import com.venuevibe.orchestrator.client.OpenTripMapClient;
import com.venuevibe.orchestrator.client.WikidataClient;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.VenueCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Venue enrichment")
class VenueEnrichmentServiceTest {

    @Mock
    private WikidataClient wikidata;

    @Mock
    private OpenTripMapClient openTripMap;

    @InjectMocks
    private VenueEnrichmentService service;

    private static VenueCandidate candidate(String id, String wikidataId) {
        return VenueCandidate.builder()
                .placeId(id)
                .provider("overpass")
                .name("Venue " + id)
                .location(new GeoPoint(48.85, 2.35))
                .wikidataId(wikidataId)
                .build();
    }

    @Test
    @DisplayName("Wikidata image and description are added to a copy, leaving the input untouched")
    void enrich_appliesWikidata() {
        // Given
        VenueCandidate original = candidate("a", "Q1");
        when(wikidata.fetchEntities(anyCollection()))
                .thenReturn(Map.of("Q1", new WikidataClient.Entry("historic café", "https://commons/img.jpg")));
        when(openTripMap.isEnabled()).thenReturn(false);

        // When
        List<VenueCandidate> enriched = service.enrich(List.of(original));

        // Then
        assertThat(enriched).singleElement().satisfies(v -> {
            assertThat(v.getPhotos()).containsExactly("https://commons/img.jpg");
            assertThat(v.getDescription()).isEqualTo("historic café");
        });
        assertThat(original.getPhotos()).isEmpty();
        assertThat(original.getDescription()).isNull();
    }

    @Test
    @DisplayName("OpenTripMap fills a missing image and rating")
    void enrich_appliesOpenTripMap() {
        VenueCandidate original = candidate("b", null);
        when(wikidata.fetchEntities(anyCollection())).thenReturn(Map.of());
        when(openTripMap.isEnabled()).thenReturn(true);
        when(openTripMap.lookup(eq("Venue b"), any(GeoPoint.class)))
                .thenReturn(Optional.of(new OpenTripMapClient.Place(2, "https://otm/img.jpg", "A landmark.")));

        List<VenueCandidate> enriched = service.enrich(List.of(original));

        assertThat(enriched.get(0).getRating()).isEqualTo(4.0);
        assertThat(enriched.get(0).getPhotos()).containsExactly("https://otm/img.jpg");
        assertThat(enriched.get(0).getDescription()).isEqualTo("A landmark.");
    }

    @Test
    @DisplayName("Candidates that already have an image and a rating skip OpenTripMap")
    void enrich_skipsCompleteCandidates() {
        VenueCandidate complete = candidate("c", null).toBuilder()
                .rating(4.2)
                .photos(new ArrayList<>(List.of("https://img/existing.jpg")))
                .build();
        when(wikidata.fetchEntities(anyCollection())).thenReturn(Map.of());

        List<VenueCandidate> enriched = service.enrich(List.of(complete));

        assertThat(enriched).containsExactly(complete);
        verify(openTripMap, never()).lookup(any(), any());
    }

    @Test
    @DisplayName("A failing lookup leaves that candidate unenriched without affecting others")
    void enrich_absorbsPerCandidateFailures() {
        VenueCandidate failing = candidate("d", null);
        VenueCandidate fine = candidate("e", null);
        when(wikidata.fetchEntities(anyCollection())).thenReturn(Map.of());
        when(openTripMap.isEnabled()).thenReturn(true);
        when(openTripMap.lookup(eq("Venue d"), any(GeoPoint.class))).thenThrow(new IllegalStateException("boom"));
        when(openTripMap.lookup(eq("Venue e"), any(GeoPoint.class)))
                .thenReturn(Optional.of(new OpenTripMapClient.Place(1, null, null)));

        List<VenueCandidate> enriched = service.enrich(List.of(failing, fine));

        assertThat(enriched.get(0)).isSameAs(failing);
        assertThat(enriched.get(1).getRating()).isEqualTo(3.0);
    }
}
