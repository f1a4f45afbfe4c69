package com.venuevibe.orchestrator.service;

import com.venuevibe.orchestrator.admission.SlidingWindowRateLimiter;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MaintenanceSchedulerTest {

    @Test
    void sweep_purgesExpiredEntriesAndIdleWindows() {
        // Given
        MutableClock clock = MutableClock.atEpochMillis(0);
        ExpiringLruCache<String> geocode = new ExpiringLruCache<>("geocode", 10, Duration.ofMinutes(1), clock);
        ExpiringLruCache<Integer> places = new ExpiringLruCache<>("place-search", 10, Duration.ofHours(1), clock);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(clock);

        geocode.set("geocode:paris", "Paris");
        places.set("overpass:bar|0.000|0.000|1000", 3);
        limiter.check("global:1.2.3.4", 30, Duration.ofMinutes(1));
        limiter.check("provider:tomtom", 2500, Duration.ofHours(24));

        MaintenanceScheduler scheduler = new MaintenanceScheduler(List.of(geocode, places), limiter);

        // When
        clock.advance(Duration.ofMinutes(5));
        scheduler.sweep();

        // Then
        assertThat(geocode.size()).isZero();
        assertThat(places.size()).isEqualTo(1);
        assertThat(limiter.size()).isEqualTo(1);
        assertThat(limiter.countFor("provider:tomtom")).isEqualTo(1);
    }
}
