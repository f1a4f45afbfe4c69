package com.venuevibe.orchestrator.client;

import com.venuevibe.orchestrator.admission.SlidingWindowRateLimiter;
import com.venuevibe.orchestrator.exception.QuotaExceededException;
import com.venuevibe.orchestrator.support.MutableClock;
import com.venuevibe.orchestrator.support.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderQuotaTest {

    @Test
    void acquire_failsOnceBudgetIsSpent_andRecoversAfterWindow() {
        // Given
        MutableClock clock = MutableClock.atEpochMillis(0);
        ProviderQuota quota = new ProviderQuota("tomtom", 2, Duration.ofHours(24), new SlidingWindowRateLimiter(clock));

        // When
        quota.acquire();
        clock.advance(Duration.ofHours(1));
        quota.acquire();

        // Then
        assertThat(quota.used()).isEqualTo(2);
        assertThatThrownBy(quota::acquire)
                .isInstanceOf(QuotaExceededException.class)
                .hasMessageContaining("tomtom")
                .satisfies(e -> assertThat(((QuotaExceededException) e).getRetryAfterSeconds())
                        .isEqualTo(23 * 3600));

        clock.advance(Duration.ofHours(23));
        quota.acquire();
        assertThat(quota.used()).isEqualTo(2);
    }

    @Test
    void throttle_spacesPermitsByMinInterval() {
        MutableClock clock = MutableClock.atEpochMillis(0);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        OutboundThrottle throttle = new OutboundThrottle("nominatim", Duration.ofSeconds(1), clock, sleeper);

        throttle.acquire();
        clock.advanceMillis(300);
        throttle.acquire();
        clock.advance(Duration.ofSeconds(5));
        throttle.acquire();

        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofMillis(700));
    }
}
