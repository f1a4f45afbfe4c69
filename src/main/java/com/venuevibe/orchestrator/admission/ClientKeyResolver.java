package com.venuevibe.orchestrator.admission;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Extracts the client identity used for admission control.
 *
 * <p>Order: first entry of {@code X-Forwarded-For}, then {@code X-Real-IP}, then the socket
 * address. Requests behind a proxy that strips both headers share the proxy's key.
 */
public final class ClientKeyResolver {

    static final String UNKNOWN = "unknown";

    private ClientKeyResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : UNKNOWN;
    }
}
