package com.venuevibe.orchestrator.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.api.ApiError;
import com.venuevibe.orchestrator.config.RateLimitProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.format.DateTimeFormatter;

/**
 * HTTP side of admission control: runs the {@link AdmissionGateway} before the controller and
 * translates its decision into rate-limit headers or a 429 response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdmissionInterceptor implements HandlerInterceptor {

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";
    static final String HEADER_RETRY_AFTER = "Retry-After";

    private final AdmissionGateway gateway;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!properties.isEnabled()) {
            return true;
        }

        String clientKey = ClientKeyResolver.resolve(request);
        String route = gateway.resolveRoute(request.getRequestURI());
        AdmissionDecision decision = gateway.admit(clientKey, route);
        RateLimitDecision reported = decision.reported();

        response.setHeader(HEADER_LIMIT, String.valueOf(reported.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(reported.remaining()));
        response.setHeader(HEADER_RESET, DateTimeFormatter.ISO_INSTANT.format(reported.resetAt()));

        if (decision.allowed()) {
            return true;
        }

        int retryAfter = reported.retryAfterSecondsOr(properties.getDefaultRetryAfterSeconds());
        log.warn("Rejected {} {} from {} (scope={}, retryAfter={}s)",
                request.getMethod(), request.getRequestURI(), clientKey, decision.scope(), retryAfter);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HEADER_RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ApiError body = ApiError.builder()
                .error("Rate limit exceeded. Please try again later.")
                .code("RATE_LIMIT_EXCEEDED")
                .retryAfter(retryAfter)
                .build();
        objectMapper.writeValue(response.getOutputStream(), body);
        return false;
    }
}
