package com.venuevibe.orchestrator.client;

import java.net.URI;
import java.util.Map;

/**
 * Plain HTTP access for provider adapters.
 *
 * <p>Implementations return every HTTP response, whatever its status. Failures that produce
 * no response at all (connection reset, timeout, DNS, refused) are raised as
 * {@link com.venuevibe.orchestrator.exception.UpstreamTransportException}.
 */
public interface UpstreamHttpClient {

    UpstreamResponse get(String provider, URI uri, Map<String, String> headers);

    UpstreamResponse post(String provider, URI uri, Map<String, String> headers, String contentType, String body);
}
