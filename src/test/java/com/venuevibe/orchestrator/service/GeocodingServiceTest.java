package com.venuevibe.orchestrator.service;

import com.venuevibe.orchestrator.client.NominatimGeocodingClient;
import com.venuevibe.orchestrator.model.GeocodedLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeocodingServiceTest {

    @Mock
    private NominatimGeocodingClient nominatim;

    @InjectMocks
    private GeocodingService service;

    @Test
    @DisplayName("Valid text is passed to Nominatim")
    void geocode_delegates() {
        GeocodedLocation paris = new GeocodedLocation(48.8566, 2.3522, "Paris, France");
        when(nominatim.geocode("Paris")).thenReturn(paris);

        assertThat(service.geocode("Paris")).isEqualTo(paris);
    }

    @Test
    @DisplayName("Blank or overlong text is rejected before any upstream call")
    void geocode_validatesInput() {
        assertThatThrownBy(() -> service.geocode(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.geocode("x".repeat(GeocodingService.MAX_LOCATION_LENGTH + 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("200 characters");

        verify(nominatim, never()).geocode(anyString());
    }
}
