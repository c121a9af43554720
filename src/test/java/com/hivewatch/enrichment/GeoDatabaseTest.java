package com.hivewatch.enrichment;

import com.hivewatch.MutableClock;
import com.hivewatch.domain.GeoLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GeoDatabase Tests")
class GeoDatabaseTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    @DisplayName("Should resolve addresses to the range that contains them")
    void shouldLocateByRange(@TempDir Path dir) throws IOException {
        // Given
        Path csv = dir.resolve("geo.csv");
        Files.writeString(csv, String.join("\n",
            "start_ip,end_ip,country_code,country,city,lat,lon",
            "# sample ranges",
            "1.0.0.0,1.0.0.255,AU,Australia,Sydney,-33.86,151.20",
            "5.6.0.0,5.6.255.255,DE,Germany,Berlin,52.52,13.40",
            "broken,row"));

        // When
        GeoDatabase db = GeoDatabase.load(csv, clock);
        Optional<GeoLocation> berlin = db.locate("5.6.7.8");
        Optional<GeoLocation> gap = db.locate("3.3.3.3");

        // Then
        assertThat(db.size()).isEqualTo(2);
        assertThat(berlin).isPresent();
        assertThat(berlin.get().getCountryCode()).isEqualTo("DE");
        assertThat(berlin.get().getCity()).isEqualTo("Berlin");
        assertThat(berlin.get().getLookupTimestamp()).isEqualTo(clock.instant());
        assertThat(gap).isEmpty();
    }

    @Test
    @DisplayName("Should report unavailable when no database was loaded")
    void shouldBeUnavailableWhenEmpty() {
        GeoDatabase db = GeoDatabase.empty(clock);

        assertThatThrownBy(() -> db.locate("1.2.3.4")).isInstanceOf(EnrichmentUnavailableException.class);
    }
}
