package com.venuevibe.orchestrator.support;

import com.venuevibe.orchestrator.client.UpstreamHttpClient;
import com.venuevibe.orchestrator.client.UpstreamResponse;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scripted {@link UpstreamHttpClient}: answers queued in order, every request recorded.
 * When the queue runs dry the last answer is repeated.
 */
public class FakeUpstreamHttpClient implements UpstreamHttpClient {

    public record Request(String method, URI uri, Map<String, String> headers, String body) {
    }

    private final Deque<Supplier<UpstreamResponse>> answers = new ArrayDeque<>();
    private final List<Request> requests = new ArrayList<>();
    private Supplier<UpstreamResponse> last;

    public FakeUpstreamHttpClient respond(int status, String body) {
        answers.add(() -> new UpstreamResponse(status, body));
        return this;
    }

    public FakeUpstreamHttpClient fail(RuntimeException error) {
        answers.add(() -> {
            throw error;
        });
        return this;
    }

    @Override
    public synchronized UpstreamResponse get(String provider, URI uri, Map<String, String> headers) {
        requests.add(new Request("GET", uri, headers, null));
        return next();
    }

    @Override
    public synchronized UpstreamResponse post(String provider, URI uri, Map<String, String> headers,
                                              String contentType, String body) {
        requests.add(new Request("POST", uri, headers, body));
        return next();
    }

    private UpstreamResponse next() {
        Supplier<UpstreamResponse> answer = answers.isEmpty() ? last : answers.poll();
        if (answer == null) {
            throw new IllegalStateException("No scripted response");
        }
        last = answer;
        return answer.get();
    }

    public synchronized List<Request> getRequests() {
        return List.copyOf(requests);
    }
}
