package com.venuevibe.orchestrator.client;

import com.venuevibe.orchestrator.exception.TransportErrorCategory;
import com.venuevibe.orchestrator.exception.UpstreamTransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link UpstreamHttpClient} on top of the shared Reactor Netty {@link WebClient}.
 * Calls block the invoking thread; the orchestrator provides the concurrency.
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientUpstreamHttpClient implements UpstreamHttpClient {

    private final WebClient webClient;

    @Override
    public UpstreamResponse get(String provider, URI uri, Map<String, String> headers) {
        return execute(provider, webClient.get()
                .uri(uri)
                .headers(h -> applyHeaders(h, headers))
                .exchangeToMono(this::toResponse));
    }

    @Override
    public UpstreamResponse post(String provider, URI uri, Map<String, String> headers, String contentType, String body) {
        return execute(provider, webClient.post()
                .uri(uri)
                .headers(h -> {
                    applyHeaders(h, headers);
                    h.set(HttpHeaders.CONTENT_TYPE, contentType);
                })
                .bodyValue(body)
                .exchangeToMono(this::toResponse));
    }

    private Mono<UpstreamResponse> toResponse(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new UpstreamResponse(response.statusCode().value(), body));
    }

    private UpstreamResponse execute(String provider, Mono<UpstreamResponse> exchange) {
        try {
            UpstreamResponse response = exchange.block();
            if (response == null) {
                throw new UpstreamTransportException(provider, TransportErrorCategory.OTHER,
                        new IOException("No response received"));
            }
            return response;
        } catch (WebClientRequestException e) {
            throw UpstreamTransportException.from(provider, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof IOException || cause instanceof TimeoutException) {
                throw UpstreamTransportException.from(provider, cause);
            }
            throw e;
        }
    }

    private static void applyHeaders(HttpHeaders target, Map<String, String> headers) {
        if (headers != null) {
            headers.forEach(target::set);
        }
    }
}
