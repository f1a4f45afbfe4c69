package com.venuevibe.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuevibe.orchestrator.cache.ExpiringLruCache;
import com.venuevibe.orchestrator.config.ProviderProperties;
import com.venuevibe.orchestrator.exception.LocationNotFoundException;
import com.venuevibe.orchestrator.exception.MalformedResponseException;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import com.venuevibe.orchestrator.retry.BackoffRetrier;
import com.venuevibe.orchestrator.support.FakeUpstreamHttpClient;
import com.venuevibe.orchestrator.support.MutableClock;
import com.venuevibe.orchestrator.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Nominatim geocoding")
class NominatimGeocodingClientTest {

    private static final String PARIS = """
            [{"lat": "48.8566", "lon": "2.3522", "display_name": "Paris, Île-de-France, France"}]
            """;

    private FakeUpstreamHttpClient http;
    private RecordingSleeper throttleSleeper;
    private NominatimGeocodingClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpochMillis(1_000_000);
        http = new FakeUpstreamHttpClient();
        throttleSleeper = new RecordingSleeper(clock);
        ProviderProperties properties = new ProviderProperties();

        client = new NominatimGeocodingClient(http,
                new BackoffRetrier(new RecordingSleeper(), () -> 0.0),
                new ObjectMapper(),
                properties,
                new ExpiringLruCache<>("geocode", 10, Duration.ofHours(24), clock),
                new OutboundThrottle("nominatim", Duration.ofSeconds(1), clock, throttleSleeper));
    }

    @Test
    @DisplayName("First match becomes the geocoded location")
    void geocode_returnsFirstMatch() {
        // Given
        http.respond(200, PARIS);

        // When
        GeocodedLocation location = client.geocode("Paris");

        // Then
        assertThat(location.lat()).isEqualTo(48.8566);
        assertThat(location.lng()).isEqualTo(2.3522);
        assertThat(location.displayName()).isEqualTo("Paris, Île-de-France, France");

        FakeUpstreamHttpClient.Request request = http.getRequests().get(0);
        assertThat(request.uri().getPath()).isEqualTo("/search");
        assertThat(request.uri().getQuery()).contains("q=Paris").contains("limit=1");
        assertThat(request.headers()).containsKey("User-Agent");
    }

    @Test
    @DisplayName("Equivalent texts hit the cache instead of Nominatim")
    void geocode_usesCache() {
        http.respond(200, PARIS);

        client.geocode("Paris");
        GeocodedLocation cached = client.geocode("  PARIS ");

        assertThat(cached.displayName()).startsWith("Paris");
        assertThat(http.getRequests()).hasSize(1);
    }

    @Test
    @DisplayName("No match is a LocationNotFoundException")
    void geocode_noMatch() {
        http.respond(200, "[]");

        assertThatThrownBy(() -> client.geocode("Atlantis"))
                .isInstanceOf(LocationNotFoundException.class)
                .hasMessageContaining("Atlantis");
    }

    @Test
    @DisplayName("Blank text is rejected before any request")
    void geocode_blank() {
        assertThatThrownBy(() -> client.geocode("   "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(http.getRequests()).isEmpty();
    }

    @Test
    @DisplayName("Back-to-back requests are spaced one second apart")
    void geocode_throttlesConsecutiveRequests() {
        http.respond(200, PARIS);

        client.geocode("Paris");
        client.geocode("Lyon");

        assertThat(http.getRequests()).hasSize(2);
        assertThat(throttleSleeper.getSleeps()).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Reverse geocoding returns the display name")
    void reverseGeocode_returnsDisplayName() {
        http.respond(200, "{\"display_name\": \"Eiffel Tower, Paris\"}");

        assertThat(client.reverseGeocode(48.8584, 2.2945)).isEqualTo("Eiffel Tower, Paris");
        assertThat(client.reverseGeocode(48.8584, 2.2945)).isEqualTo("Eiffel Tower, Paris");
        assertThat(http.getRequests()).hasSize(1);
    }

    @Test
    @DisplayName("Reverse geocoding without a display name is malformed")
    void reverseGeocode_missingName() {
        http.respond(200, "{\"error\": \"Unable to geocode\"}");

        assertThatThrownBy(() -> client.reverseGeocode(0.0, 0.0))
                .isInstanceOf(MalformedResponseException.class);
    }
}
