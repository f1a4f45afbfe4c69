package com.venuevibe.orchestrator.cache;

import lombok.Getter;

/**
 * A cached value with its absolute expiry and last access time (epoch millis).
 *
 * <p>Owned by exactly one {@link ExpiringLruCache}; only the cache mutates it, under its lock.
 */
@Getter
public class CacheEntry<V> {

    private final V value;
    private final long expiresAt;
    private long lastAccessedAt;

    // tie-breaker when two entries share the same millisecond
    private long accessSequence;

    CacheEntry(V value, long expiresAt, long lastAccessedAt, long accessSequence) {
        this.value = value;
        this.expiresAt = expiresAt;
        this.lastAccessedAt = lastAccessedAt;
        this.accessSequence = accessSequence;
    }

    boolean isExpired(long now) {
        return now > expiresAt;
    }

    void touch(long now, long sequence) {
        this.lastAccessedAt = now;
        this.accessSequence = sequence;
    }

    boolean isOlderThan(CacheEntry<?> other) {
        if (lastAccessedAt != other.lastAccessedAt) {
            return lastAccessedAt < other.lastAccessedAt;
        }
        return accessSequence < other.accessSequence;
    }
}
