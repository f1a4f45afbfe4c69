package com.venuevibe.orchestrator.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory cache with per-entry TTL and least-recently-used eviction.
 *
 * <p>Recency is the entry's last access time, refreshed on every hit. When a new key would
 * push the cache past {@code maxSize}, the entry with the globally oldest access time is
 * evicted first (linear scan; domains here hold a few hundred entries at most).
 *
 * <p>Expired entries are never served: a lookup that finds one deletes it and counts a miss.
 * {@link #purgeExpired()} removes the rest regardless of access patterns and is driven by
 * the maintenance scheduler.
 *
 * <p>No operation throws. A miss looks exactly like "never cached", so callers can always
 * fall back to the upstream provider.
 *
 * <p><b>Thread Safety:</b> all state is guarded by a single lock; critical sections are short
 * and never call out of this class.
 */
@Slf4j
public class ExpiringLruCache<V> {

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private final Map<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;
    private long evictions;
    private long sequence;

    public ExpiringLruCache(String name, int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache maxSize must be at least 1, was " + maxSize);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    /**
     * Returns the live value for {@code key} and refreshes its recency.
     */
    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                misses++;
                log.debug("Cache {} expired: {}", name, key);
                return Optional.empty();
            }
            entry.touch(now, ++sequence);
            hits++;
            log.debug("Cache {} hit: {}", name, key);
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, V value) {
        set(key, value, defaultTtl);
    }

    /**
     * Inserts or overwrites {@code key}. Null keys and values are ignored.
     */
    public void set(String key, V value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        lock.lock();
        try {
            long now = clock.millis();
            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                evictLeastRecentlyUsed();
            }
            entries.put(key, new CacheEntry<>(value, now + effectiveTtl.toMillis(), now, ++sequence));
            log.debug("Cache {} set: {} (ttl {}ms)", name, key, effectiveTtl.toMillis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when a live entry exists. Does not refresh recency or touch hit/miss counters.
     */
    public boolean has(String key) {
        if (key == null) {
            return false;
        }
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (entry.isExpired(clock.millis())) {
                entries.remove(key);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            log.info("Cache {} cleared", name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Cache {} cleanup removed {} expired entries", name, removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.of(name, hits, misses, evictions, entries.size());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getMaxSize() {
        return maxSize;
    }

    // caller holds the lock
    private void evictLeastRecentlyUsed() {
        String oldestKey = null;
        CacheEntry<V> oldest = null;
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (oldest == null || e.getValue().isOlderThan(oldest)) {
                oldest = e.getValue();
                oldestKey = e.getKey();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
            evictions++;
            log.debug("Cache {} evicted (LRU): {}", name, oldestKey);
        }
    }
}
