package com.venuevibe.orchestrator.admission;

import com.venuevibe.orchestrator.model.GeocodedLocation;
import com.venuevibe.orchestrator.search.VenueSearchService;
import com.venuevibe.orchestrator.service.GeocodingService;
import com.venuevibe.orchestrator.service.QueryPlannerService;
import com.venuevibe.orchestrator.service.RecommendationService;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Admission control over HTTP. The test profile limits geocoding to 3 requests per minute
 * per client.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdmissionInterceptorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GeocodingService geocodingService;

    @MockBean
    private VenueSearchService venueSearchService;

    @MockBean
    private QueryPlannerService queryPlanner;

    @MockBean
    private RecommendationService recommendationService;

    @BeforeEach
    void setUp() {
        when(geocodingService.geocode(anyString()))
                .thenReturn(new GeocodedLocation(51.5074, -0.1278, "London, United Kingdom"));
    }

    private ResultActions geocodeFrom(String client) throws Exception {
        return mockMvc.perform(post("/api/v1/geocode")
                .header("X-Forwarded-For", client + ", 10.0.0.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"location\": \"London\"}"));
    }

    @Test
    void routeLimitExceeded_returns429WithRetryAfter() throws Exception {
        // Given - three admitted requests use up the geocode allowance
        for (int i = 0; i < 3; i++) {
            geocodeFrom("192.0.2.10").andExpect(status().isOk());
        }

        // When / Then
        geocodeFrom("192.0.2.10")
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", Matchers.oneOf("59", "60")))
                .andExpect(header().string("X-RateLimit-Limit", "3"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.error").value("Rate limit exceeded. Please try again later."))
                .andExpect(jsonPath("$.retryAfter").value(Matchers.both(Matchers.greaterThan(0)).and(Matchers.lessThanOrEqualTo(60))));

        // rejected before reaching the controller
        verify(geocodingService, times(3)).geocode(anyString());
    }

    @Test
    void clientsAreLimitedIndependently() throws Exception {
        for (int i = 0; i < 3; i++) {
            geocodeFrom("192.0.2.20").andExpect(status().isOk());
        }
        geocodeFrom("192.0.2.20").andExpect(status().isTooManyRequests());

        geocodeFrom("192.0.2.21")
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Remaining", "2"));
    }

    @Test
    void remainingCountsDownWithEachRequest() throws Exception {
        geocodeFrom("192.0.2.30").andExpect(header().string("X-RateLimit-Remaining", "2"));
        geocodeFrom("192.0.2.30").andExpect(header().string("X-RateLimit-Remaining", "1"));
        geocodeFrom("192.0.2.30").andExpect(header().string("X-RateLimit-Remaining", "0"));
    }
}
