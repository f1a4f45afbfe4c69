package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.retry.RetryPolicy;
import com.venuevibe.orchestrator.support.FakeUpstreamHttpClient;
import com.venuevibe.orchestrator.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WikidataClientTest {

    private static final String ENTITIES = """
            {"entities": {
              "Q1": {"descriptions": {"en": {"value": "historic café in Paris"}},
                     "claims": {"P18": [{"mainsnak": {"datavalue": {"value": "Café de Flore.jpg"}}}]}},
              "Q2": {"descriptions": {}, "claims": {}},
              "Q3": {"id": "Q3", "missing": ""}
            }}
            """;

    private FakeUpstreamHttpClient http;
    private WikidataClient client;

    @BeforeEach
    void setUp() {
        http = new FakeUpstreamHttpClient();
        ProviderProperties properties = new ProviderProperties();
        properties.getWikidata().setRetry(RetryPolicy.builder().maxAttempts(1).build());
        client = new WikidataClient(http, new BackoffRetrier(new RecordingSleeper(), () -> 0.0),
                new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("Descriptions and P18 images are read for known ids")
    void fetchEntities_parsesEntities() {
        http.respond(200, ENTITIES);

        Map<String, WikidataClient.Entry> entries = client.fetchEntities(List.of("Q1", "Q2", "Q3", "Q1"));

        assertThat(entries).containsOnlyKeys("Q1", "Q2");
        assertThat(entries.get("Q1").description()).isEqualTo("historic café in Paris");
        assertThat(entries.get("Q1").imageUrl())
                .isEqualTo("https://commons.wikimedia.org/wiki/Special:FilePath/Caf%C3%A9_de_Flore.jpg?width=600");
        assertThat(entries.get("Q2").description()).isNull();
        assertThat(http.getRequests()).hasSize(1);
        assertThat(http.getRequests().get(0).uri().getQuery()).contains("ids=Q1|Q2|Q3");
    }

    @Test
    @DisplayName("Upstream failures yield an empty result")
    void fetchEntities_failureIsEmpty() {
        http.respond(500, "down");

        assertThat(client.fetchEntities(List.of("Q1"))).isEmpty();
    }

    @Test
    @DisplayName("No ids means no request")
    void fetchEntities_noIds() {
        assertThat(client.fetchEntities(Arrays.asList(null, null))).isEmpty();
        assertThat(http.getRequests()).isEmpty();
    }
}
