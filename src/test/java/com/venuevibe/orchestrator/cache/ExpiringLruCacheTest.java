package com.venuevibe.orchestrator.cache;

import com.venuevibe.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Expiring LRU cache")
class ExpiringLruCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(0);
    }

    @Test
    @DisplayName("Entry is served before its TTL and gone after it")
    void get_respectsTtl() {
        // Given
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 10, Duration.ofMinutes(5), clock);
        cache.set("k", "v", Duration.ofMillis(100));

        // When / Then
        clock.setMillis(50);
        assertThat(cache.get("k")).contains("v");

        clock.setMillis(150);
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Expiry is strict: an entry is live at exactly its expiry instant")
    void get_atExpiryInstant_isStillLive() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 10, Duration.ofMillis(100), clock);
        cache.set("k", "v");

        clock.setMillis(100);
        assertThat(cache.get("k")).contains("v");

        clock.setMillis(101);
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    @DisplayName("Inserting past capacity evicts exactly the least recently used entry")
    void set_atCapacity_evictsLeastRecentlyUsed() {
        // Given
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 2, Duration.ofMinutes(5), clock);
        cache.set("a", "1");
        clock.advanceMillis(1);
        cache.set("b", "2");

        // When
        clock.advanceMillis(1);
        cache.set("c", "3");

        // Then
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains("2");
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.stats().evictions()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("A hit refreshes recency, so the untouched entry is evicted instead")
    void get_refreshesRecency() {
        // Given
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 2, Duration.ofMinutes(5), clock);
        cache.set("a", "1");
        clock.advanceMillis(1);
        cache.set("b", "2");
        clock.advanceMillis(1);
        cache.get("a");

        // When
        clock.advanceMillis(1);
        cache.set("c", "3");

        // Then
        assertThat(cache.has("a")).isTrue();
        assertThat(cache.has("b")).isFalse();
        assertThat(cache.has("c")).isTrue();
    }

    @Test
    @DisplayName("Access order decides eviction even when timestamps tie")
    void eviction_withIdenticalTimestamps_followsAccessOrder() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 2, Duration.ofMinutes(5), clock);
        cache.set("a", "1");
        cache.set("b", "2");
        cache.get("a");

        cache.set("c", "3");

        assertThat(cache.has("a")).isTrue();
        assertThat(cache.has("b")).isFalse();
    }

    @Test
    @DisplayName("Overwriting an existing key never evicts")
    void set_existingKeyAtCapacity_doesNotEvict() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 2, Duration.ofMinutes(5), clock);
        cache.set("a", "1");
        cache.set("b", "2");

        cache.set("a", "1b");

        assertThat(cache.get("a")).contains("1b");
        assertThat(cache.get("b")).contains("2");
        assertThat(cache.stats().evictions()).isZero();
    }

    @Test
    @DisplayName("has() neither refreshes recency nor counts lookups")
    void has_isSideEffectFreeForLiveEntries() {
        // Given
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 2, Duration.ofMinutes(5), clock);
        cache.set("a", "1");
        clock.advanceMillis(1);
        cache.set("b", "2");

        // When
        clock.advanceMillis(1);
        assertThat(cache.has("a")).isTrue();
        cache.set("c", "3");

        // Then
        assertThat(cache.has("a")).isFalse();
        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isZero();
        assertThat(stats.misses()).isZero();
    }

    @Test
    @DisplayName("Hit rate is rounded to two decimals and zero before any lookup")
    void stats_hitRate() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 10, Duration.ofMinutes(5), clock);
        assertThat(cache.stats().hitRate()).isZero();

        cache.set("a", "1");
        cache.get("a");
        cache.get("missing");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.hitRate()).isEqualTo(0.33);
        assertThat(stats.name()).isEqualTo("test");
    }

    @Test
    @DisplayName("purgeExpired removes only expired entries")
    void purgeExpired_removesExpiredOnly() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 10, Duration.ofMinutes(5), clock);
        cache.set("short", "1", Duration.ofSeconds(1));
        cache.set("long", "2", Duration.ofHours(1));

        clock.advance(Duration.ofSeconds(2));
        int removed = cache.purgeExpired();

        assertThat(removed).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.has("long")).isTrue();
    }

    @Test
    @DisplayName("Null keys and values are ignored without throwing")
    void nullsAreIgnored() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 10, Duration.ofMinutes(5), clock);

        cache.set(null, "v");
        cache.set("k", null);

        assertThat(cache.size()).isZero();
        assertThat(cache.get(null)).isEmpty();
        assertThat(cache.has(null)).isFalse();
    }

    @Test
    @DisplayName("clear() empties the cache")
    void clear_removesEverything() {
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 10, Duration.ofMinutes(5), clock);
        cache.set("a", "1");
        cache.set("b", "2");

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    @DisplayName("A cache must hold at least one entry")
    void constructor_rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new ExpiringLruCache<String>("test", 0, Duration.ofMinutes(5), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Concurrent set/get keeps the size bound and counts every lookup once")
    void concurrentAccess_staysConsistent() throws Exception {
        // Given
        int threads = 8;
        int opsPerThread = 2000;
        ExpiringLruCache<String> cache = new ExpiringLruCache<>("test", 50, Duration.ofMinutes(5), clock);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int offset = t * 7;
                workers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < opsPerThread; i++) {
                        String key = "k" + ((i + offset) % 200);
                        if (i % 2 == 0) {
                            cache.set(key, "v" + i);
                        } else {
                            cache.get(key);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        CacheStats stats = cache.stats();
        assertThat(cache.size()).isLessThanOrEqualTo(50);
        assertThat(stats.size()).isEqualTo(cache.size());
        assertThat(stats.hits() + stats.misses()).isEqualTo((long) threads * opsPerThread / 2);
        assertThat(stats.evictions()).isPositive();
    }
}
