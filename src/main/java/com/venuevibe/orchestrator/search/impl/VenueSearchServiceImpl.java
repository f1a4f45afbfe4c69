package com.venuevibe.orchestrator.search.impl;

import com.google.common.base.Preconditions;
import com.venuevibe.orchestrator.client.DispatchPolicy;
import com.venuevibe.orchestrator.client.PlaceSearchProvider;
import com.venuevibe.orchestrator.config.SearchProperties;
import com.venuevibe.orchestrator.exception.ProviderConfigurationException;
import com.venuevibe.orchestrator.model.GeoPoint;
import com.venuevibe.orchestrator.model.VenueCandidate;
import com.venuevibe.orchestrator.retry.Sleeper;
import com.venuevibe.orchestrator.search.VenueSearchResult;
import com.venuevibe.orchestrator.search.VenueSearchService;
import com.venuevibe.orchestrator.service.VenueEnrichmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Default search pass: {@code Dispatch -> Collect -> Deduplicate -> Enrich -> Filter -> Truncate}.
 *
 * <p>Providers run in configured order. Parallel providers are submitted to the bounded
 * provider executor first, then sequential providers run on the request thread, and
 * everything is joined before results are collected. Collection order is always
 * provider-then-query, whatever order the calls completed in, which keeps first-seen-wins
 * deduplication deterministic.
 *
 * <p>Deduplication happens twice: by provider-scoped {@code placeId}, then across providers
 * on normalized name plus coordinates rounded to four decimals (about 11 m). Candidates that
 * differ on either stay separate.
 */
@Slf4j
@Service
public class VenueSearchServiceImpl implements VenueSearchService {

    private final List<PlaceSearchProvider> providers;
    private final VenueEnrichmentService enrichmentService;
    private final SearchProperties properties;
    private final Executor providerExecutor;
    private final Sleeper sleeper;

    public VenueSearchServiceImpl(List<PlaceSearchProvider> availableProviders,
                                  VenueEnrichmentService enrichmentService,
                                  SearchProperties properties,
                                  @Qualifier("providerExecutor") Executor providerExecutor,
                                  Sleeper sleeper) {
        this.providers = orderProviders(availableProviders, properties.getProviders());
        this.enrichmentService = enrichmentService;
        this.properties = properties;
        this.providerExecutor = providerExecutor;
        this.sleeper = sleeper;
        log.info("Place search providers in dispatch order: {}",
                providers.stream().map(PlaceSearchProvider::name).toList());
    }

    @Override
    public VenueSearchResult search(List<String> queries, GeoPoint location, int radiusMeters) {
        Preconditions.checkNotNull(location, "location is required");
        Preconditions.checkArgument(radiusMeters > 0, "radius must be positive");

        List<String> usedQueries = queries == null ? List.of() : queries.stream()
                .filter(q -> q != null && !q.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        if (usedQueries.isEmpty()) {
            return VenueSearchResult.empty(usedQueries);
        }

        List<PlaceSearchProvider> enabled = providers.stream().filter(PlaceSearchProvider::isEnabled).toList();
        log.info("Searching {} queries across {} providers within {}m of {},{}",
                usedQueries.size(), enabled.size(), radiusMeters, location.lat(), location.lng());

        List<VenueCandidate> collected = dispatchAndCollect(enabled, usedQueries, location, radiusMeters);
        List<VenueCandidate> unique = deduplicate(collected);
        List<VenueCandidate> enriched = enrich(unique);
        List<VenueCandidate> filtered = applyQualityFilter(enriched);
        List<VenueCandidate> venues = filtered.stream().limit(properties.getMaxResults()).toList();

        log.info("Search pass done: {} collected, {} unique, {} returned", collected.size(), unique.size(), venues.size());
        return new VenueSearchResult(venues, usedQueries);
    }

    // ---------------------------------------------------------------------
    // Dispatch and collect
    // ---------------------------------------------------------------------

    private List<VenueCandidate> dispatchAndCollect(List<PlaceSearchProvider> enabled, List<String> queries,
                                                    GeoPoint location, int radius) {
        Map<PlaceSearchProvider, List<CompletableFuture<List<VenueCandidate>>>> pending = new LinkedHashMap<>();
        for (PlaceSearchProvider provider : enabled) {
            if (provider.dispatchPolicy().mode() == DispatchPolicy.Mode.PARALLEL) {
                pending.put(provider, queries.stream()
                        .map(q -> CompletableFuture.supplyAsync(() -> collect(provider, q, location, radius), providerExecutor))
                        .toList());
            }
        }

        Map<PlaceSearchProvider, List<List<VenueCandidate>>> results = new LinkedHashMap<>();
        for (PlaceSearchProvider provider : enabled) {
            if (provider.dispatchPolicy().mode() == DispatchPolicy.Mode.SEQUENTIAL) {
                results.put(provider, runSequentially(provider, queries, location, radius));
            }
        }
        for (Map.Entry<PlaceSearchProvider, List<CompletableFuture<List<VenueCandidate>>>> entry : pending.entrySet()) {
            results.put(entry.getKey(), join(entry.getValue()));
        }

        List<VenueCandidate> collected = new ArrayList<>();
        for (PlaceSearchProvider provider : enabled) {
            results.getOrDefault(provider, List.of()).forEach(collected::addAll);
        }
        return collected;
    }

    private List<List<VenueCandidate>> runSequentially(PlaceSearchProvider provider, List<String> queries,
                                                       GeoPoint location, int radius) {
        List<List<VenueCandidate>> perQuery = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            perQuery.add(collect(provider, queries.get(i), location, radius));
            if (i < queries.size() - 1 && !provider.dispatchPolicy().interQueryDelay().isZero()) {
                try {
                    sleeper.sleep(provider.dispatchPolicy().interQueryDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted between {} queries, skipping the remaining {}", provider.name(), queries.size() - i - 1);
                    break;
                }
            }
        }
        return perQuery;
    }

    private static List<List<VenueCandidate>> join(List<CompletableFuture<List<VenueCandidate>>> futures) {
        List<List<VenueCandidate>> perQuery = new ArrayList<>();
        for (CompletableFuture<List<VenueCandidate>> future : futures) {
            try {
                perQuery.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        return perQuery;
    }

    /**
     * One provider, one query. Everything except a configuration error counts as no results.
     */
    private List<VenueCandidate> collect(PlaceSearchProvider provider, String query, GeoPoint location, int radius) {
        try {
            List<VenueCandidate> found = provider.search(query, location, radius);
            return found != null ? found : List.of();
        } catch (ProviderConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{} search for '{}' failed, treating as no results: {}", provider.name(), query, e.getMessage());
            return List.of();
        }
    }

    // ---------------------------------------------------------------------
    // Deduplicate
    // ---------------------------------------------------------------------

    List<VenueCandidate> deduplicate(List<VenueCandidate> collected) {
        Map<String, VenueCandidate> byIdentity = new LinkedHashMap<>();
        for (VenueCandidate candidate : collected) {
            if (candidate.getPlaceId() != null) {
                byIdentity.putIfAbsent(candidate.getPlaceId(), candidate);
            }
        }

        Map<String, VenueCandidate> byComposite = new LinkedHashMap<>();
        for (VenueCandidate candidate : byIdentity.values()) {
            String key = compositeKey(candidate);
            VenueCandidate existing = byComposite.get(key);
            byComposite.put(key, existing == null ? candidate : merge(existing, candidate));
        }
        return new ArrayList<>(byComposite.values());
    }

    static String compositeKey(VenueCandidate candidate) {
        if (candidate.getName() == null || candidate.getLocation() == null) {
            return "id:" + candidate.getPlaceId();
        }
        String name = candidate.getName().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return String.format(Locale.ROOT, "%s|%.4f|%.4f",
                name, candidate.getLocation().lat(), candidate.getLocation().lng());
    }

    /**
     * The first-seen candidate keeps its identity and values; the other one only fills gaps.
     */
    static VenueCandidate merge(VenueCandidate first, VenueCandidate second) {
        return first.toBuilder()
                .rating(first.getRating() != null ? first.getRating() : second.getRating())
                .priceLevel(first.getPriceLevel() != null ? first.getPriceLevel() : second.getPriceLevel())
                .description(first.getDescription() != null ? first.getDescription() : second.getDescription())
                .wikidataId(first.getWikidataId() != null ? first.getWikidataId() : second.getWikidataId())
                .photos(union(first.getPhotos(), second.getPhotos()))
                .reviews(union(first.getReviews(), second.getReviews()))
                .openingHours(first.getOpeningHours() != null && !first.getOpeningHours().isEmpty()
                        ? first.getOpeningHours()
                        : second.getOpeningHours())
                .build();
    }

    private static <T> List<T> union(List<T> a, List<T> b) {
        LinkedHashSet<T> all = new LinkedHashSet<>();
        if (a != null) {
            all.addAll(a);
        }
        if (b != null) {
            all.addAll(b);
        }
        return new ArrayList<>(all);
    }

    // ---------------------------------------------------------------------
    // Enrich, filter
    // ---------------------------------------------------------------------

    private List<VenueCandidate> enrich(List<VenueCandidate> unique) {
        int limit = Math.min(properties.getEnrichmentLimit(), unique.size());
        if (limit == 0) {
            return unique;
        }
        List<VenueCandidate> result = new ArrayList<>(unique.size());
        try {
            result.addAll(enrichmentService.enrich(unique.subList(0, limit)));
        } catch (RuntimeException e) {
            log.warn("Enrichment failed, continuing with unenriched venues: {}", e.getMessage());
            result.addAll(unique.subList(0, limit));
        }
        result.addAll(unique.subList(limit, unique.size()));
        return result;
    }

    List<VenueCandidate> applyQualityFilter(List<VenueCandidate> venues) {
        List<VenueCandidate> withSignal = venues.stream()
                .filter(VenueCandidate::hasQualitySignal)
                .collect(Collectors.toList());
        if (withSignal.size() < properties.getMinimumFilteredResults()) {
            log.debug("Only {} venues have a rating, photo or review; skipping the quality filter", withSignal.size());
            return venues;
        }
        return withSignal;
    }

    private static List<PlaceSearchProvider> orderProviders(List<PlaceSearchProvider> available, List<String> order) {
        if (order == null || order.isEmpty()) {
            return List.copyOf(available);
        }
        Map<String, PlaceSearchProvider> byName = available.stream()
                .collect(Collectors.toMap(PlaceSearchProvider::name, p -> p, (a, b) -> a, LinkedHashMap::new));
        List<PlaceSearchProvider> ordered = new ArrayList<>();
        for (String name : order) {
            PlaceSearchProvider provider = byName.remove(name);
            if (provider != null) {
                ordered.add(provider);
            } else {
                log.warn("Configured place search provider '{}' does not exist", name);
            }
        }
        if (!byName.isEmpty()) {
            log.info("Place search providers not listed in app.search.providers are unused: {}", byName.keySet());
        }
        return ordered;
    }
}
