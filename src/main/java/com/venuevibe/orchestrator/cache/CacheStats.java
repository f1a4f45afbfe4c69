package com.venuevibe.orchestrator.cache;

/**
 * Point-in-time counters of one cache domain.
 *
 * @param hitRate hits / (hits + misses), rounded to two decimals; 0 before the first lookup
 */
public record CacheStats(String name, long hits, long misses, long evictions, int size, double hitRate) {

    static CacheStats of(String name, long hits, long misses, long evictions, int size) {
        long lookups = hits + misses;
        double rate = lookups > 0 ? (double) hits / lookups : 0.0;
        return new CacheStats(name, hits, misses, evictions, size, Math.round(rate * 100) / 100.0);
    }
}
