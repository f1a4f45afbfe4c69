package com.venuevibe.orchestrator.admission;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-identifier admission control over a true sliding window of request timestamps.
 *
 * <p>Each check first discards timestamps at least {@code window} old, then admits when fewer
 * than {@code limit} remain. Because the window moves with every request, bursts on either
 * side of a boundary can never exceed {@code limit} inside any window-length interval.
 *
 * <p>Identifiers are independent. Callers compose scope and client key themselves
 * ({@code "global:" + ip}, {@code "search:" + ip}, {@code "provider:tomtom"}).
 *
 * <p>State is process-local and lost on restart; the limits are best-effort fair use.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final Clock clock;
    private final Map<String, WindowEntry> windows = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlidingWindowRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public RateLimitDecision check(String identifier, int limit, Duration window) {
        long windowMs = window.toMillis();
        lock.lock();
        try {
            long now = clock.millis();
            WindowEntry entry = windows.computeIfAbsent(identifier, id -> new WindowEntry());
            entry.windowMs = windowMs;
            entry.dropOlderThan(now);

            int count = entry.timestamps.size();
            boolean allowed = count < limit;
            Long oldest = entry.timestamps.peekFirst();
            long resetAt = oldest != null ? oldest + windowMs : now + windowMs;

            if (allowed) {
                entry.timestamps.addLast(now);
                return new RateLimitDecision(true, limit, limit - (count + 1), Instant.ofEpochMilli(resetAt), null);
            }

            if (entry.timestamps.isEmpty()) {
                // limit <= 0: nothing will ever be admitted; keep the map free of empty records
                windows.remove(identifier);
            }
            int retryAfter = (int) Math.ceil((resetAt - now) / 1000.0);
            log.warn("Rate limit exceeded: {} ({} req / {}ms), retry after {}s", identifier, limit, windowMs, retryAfter);
            return new RateLimitDecision(false, limit, 0, Instant.ofEpochMilli(resetAt), retryAfter);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets all history for one identifier.
     */
    public void reset(String identifier) {
        lock.lock();
        try {
            windows.remove(identifier);
            log.info("Rate limit reset: {}", identifier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops aged-out timestamps everywhere and removes identifiers left with none.
     *
     * @return number of identifiers removed
     */
    public int sweep() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<WindowEntry> it = windows.values().iterator();
            while (it.hasNext()) {
                WindowEntry entry = it.next();
                entry.dropOlderThan(now);
                if (entry.timestamps.isEmpty()) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Rate limiter cleanup removed {} idle identifiers", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of identifiers currently tracked.
     */
    public int size() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests counted for {@code identifier} as of the last check or sweep.
     */
    public int countFor(String identifier) {
        lock.lock();
        try {
            WindowEntry entry = windows.get(identifier);
            return entry != null ? entry.timestamps.size() : 0;
        } finally {
            lock.unlock();
        }
    }

    private static final class WindowEntry {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private long windowMs;

        // timestamps are appended in clock order, so the stale ones sit at the head
        void dropOlderThan(long now) {
            while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowMs) {
                timestamps.pollFirst();
            }
        }
    }
}
