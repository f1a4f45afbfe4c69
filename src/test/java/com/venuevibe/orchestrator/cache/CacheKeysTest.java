package com.venuevibe.orchestrator.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    @DisplayName("Equivalent location texts share one geocode key")
    void geocode_normalizesWhitespaceAndCase() {
        assertThat(CacheKeys.geocode("  New   York, NY "))
                .isEqualTo(CacheKeys.geocode("new york, ny"))
                .isEqualTo("geocode:new york, ny");
    }

    @Test
    @DisplayName("Place search keys round coordinates to three decimals")
    void placeSearch_roundsCoordinates() {
        String a = CacheKeys.placeSearch("overpass", "Italian Restaurant", 40.71281, -74.00601, 2000);
        String b = CacheKeys.placeSearch("overpass", "italian restaurant", 40.71249, -74.00649, 2000);

        assertThat(a).isEqualTo("overpass:italian restaurant|40.713|-74.006|2000");
        assertThat(b).isEqualTo(a);
        assertThat(CacheKeys.placeSearch("tomtom", "italian restaurant", 40.71281, -74.00601, 2000)).isNotEqualTo(a);
    }
}
