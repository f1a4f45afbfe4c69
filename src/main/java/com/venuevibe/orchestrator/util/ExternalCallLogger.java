package com.venuevibe.orchestrator.util;

import com.venuevibe.orchestrator.model.CallContext;
import com.venuevibe.orchestrator.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for outbound provider calls (geocoding, place search, enrichment, inference).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
