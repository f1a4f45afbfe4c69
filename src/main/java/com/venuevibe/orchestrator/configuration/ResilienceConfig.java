package com.venuevibe.orchestrator.configuration;

import com.venuevibe.orchestrator.admission.SlidingWindowRateLimiter;
import com.venuevibe.orchestrator.client.OutboundThrottle;
import com.venuevibe.orchestrator.client.ProviderQuota;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.retry.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Time source, retrier, rate limiter and the outbound limits built on them. Throttles and
 * quotas are context-owned singletons so every adapter instance shares the same budget.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public BackoffRetrier backoffRetrier(Sleeper sleeper) {
        return new BackoffRetrier(sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(Clock clock) {
        return new SlidingWindowRateLimiter(clock);
    }

    @Bean
    public OutboundThrottle nominatimThrottle(ProviderProperties properties, Clock clock, Sleeper sleeper) {
        return new OutboundThrottle("nominatim", properties.getNominatim().getMinInterval(), clock, sleeper);
    }

    @Bean
    public ProviderQuota tomtomQuota(ProviderProperties properties, SlidingWindowRateLimiter limiter) {
        ProviderProperties.TomTom tomtom = properties.getTomtom();
        return new ProviderQuota("tomtom", tomtom.getDailyQuota(), tomtom.getQuotaWindow(), limiter);
    }
}
