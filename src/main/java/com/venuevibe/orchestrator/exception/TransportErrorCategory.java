package com.venuevibe.orchestrator.exception;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Transport-level failure kinds the retry allow-list can name.
 */
public enum TransportErrorCategory {
    CONNECTION_RESET,
    TIMEOUT,
    DNS_FAILURE,
    CONNECTION_REFUSED,
    OTHER;

    /**
     * Walks the cause chain and returns the first recognizable category.
     *
     * <p>Netty's timeout and premature-close exceptions are matched by simple class name so
     * this stays independent of the transport implementation.
     */
    public static TransportErrorCategory classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            TransportErrorCategory category = classifySingle(current);
            if (category != OTHER) {
                return category;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return OTHER;
    }

    private static TransportErrorCategory classifySingle(Throwable error) {
        String type = error.getClass().getSimpleName();
        String message = error.getMessage() != null ? error.getMessage().toLowerCase(Locale.ROOT) : "";

        if (error instanceof UnknownHostException || message.contains("failed to resolve")) {
            return DNS_FAILURE;
        }
        if (error instanceof SocketTimeoutException || error instanceof TimeoutException
                || type.endsWith("TimeoutException") || message.contains("timed out")) {
            return TIMEOUT;
        }
        if (error instanceof ConnectException || error instanceof NoRouteToHostException
                || message.contains("connection refused")) {
            return CONNECTION_REFUSED;
        }
        if (message.contains("connection reset") || message.contains("broken pipe")
                || type.equals("PrematureCloseException")) {
            return CONNECTION_RESET;
        }
        return OTHER;
    }
}
