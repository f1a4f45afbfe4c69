package com.venuevibe.orchestrator.admission;

import com.venuevibe.orchestrator.config.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Applies the global gate and then the per-route gate before any orchestration work begins.
 *
 * <p>A request must pass both. The global check runs first and counts even when the route
 * gate then rejects; a request rejected globally never reaches the route gate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdmissionGateway {

    static final String GLOBAL_SCOPE = "global";

    private final SlidingWindowRateLimiter rateLimiter;
    private final RateLimitProperties properties;

    /**
     * @param clientKey caller identity, usually the client IP
     * @param route     configured route name, or {@code null} for global-only admission
     */
    public AdmissionDecision admit(String clientKey, String route) {
        RateLimitProperties.Limit global = properties.getGlobal();
        RateLimitDecision globalDecision = rateLimiter.check(
                GLOBAL_SCOPE + ":" + clientKey, global.getLimit(), global.getWindow());
        if (!globalDecision.allowed()) {
            return new AdmissionDecision(false, GLOBAL_SCOPE, globalDecision);
        }

        RateLimitProperties.Limit routeLimit = route != null ? properties.getRoutes().get(route) : null;
        if (routeLimit == null) {
            return new AdmissionDecision(true, GLOBAL_SCOPE, globalDecision);
        }

        RateLimitDecision routeDecision = rateLimiter.check(
                route + ":" + clientKey, routeLimit.getLimit(), routeLimit.getWindow());
        if (!routeDecision.allowed()) {
            log.info("Route gate '{}' rejected client {}", route, clientKey);
            return new AdmissionDecision(false, route, routeDecision);
        }

        return routeDecision.remaining() < globalDecision.remaining()
                ? new AdmissionDecision(true, route, routeDecision)
                : new AdmissionDecision(true, GLOBAL_SCOPE, globalDecision);
    }

    /**
     * Maps a request path to the configured route whose path prefix matches it.
     */
    public String resolveRoute(String requestPath) {
        if (requestPath == null) {
            return null;
        }
        return properties.getRoutes().entrySet().stream()
                .filter(e -> e.getValue().getPath() != null && requestPath.startsWith(e.getValue().getPath()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }
}
