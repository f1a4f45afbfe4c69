package com.venuevibe.orchestrator.client;

import com.venuevibe.orchestrator.exception.TransportErrorCategory;
import com.venuevibe.orchestrator.exception.UpstreamTransportException;
import com.venuevibe.orchestrator.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Keeps outbound requests to one provider at least {@code minInterval} apart by waiting,
 * never by rejecting. Callers queue up on the monitor.
 */
@Slf4j
public class OutboundThrottle {

    private final String provider;
    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private long lastPermitMillis = Long.MIN_VALUE;

    public OutboundThrottle(String provider, Duration minInterval, Clock clock, Sleeper sleeper) {
        this.provider = provider;
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() {
        long now = clock.millis();
        if (lastPermitMillis != Long.MIN_VALUE) {
            long wait = lastPermitMillis + minInterval.toMillis() - now;
            if (wait > 0) {
                log.debug("Throttling {} for {}ms", provider, wait);
                try {
                    sleeper.sleep(Duration.ofMillis(wait));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new UpstreamTransportException(provider, TransportErrorCategory.OTHER, e);
                }
            }
        }
        lastPermitMillis = clock.millis();
    }
}
