package com.ridedispatch.dispatch.geo;

import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.metrics.DispatchMetrics;
import com.ridedispatch.dispatch.repository.DriverRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DurableGeoIndexTest {

    @Mock private DriverRepository driverRepository;

    private SimpleMeterRegistry meterRegistry;
    private DurableGeoIndex index;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        index = new DurableGeoIndex(driverRepository, new DispatchMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Drivers table answers ranked by distance, cut to the radius, and counted as a fallback")
    void rankedWithinRadius() {
        when(driverRepository.findOnlineWithin(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(List.of(
                        driver("corner", 34.044, -6.748),
                        driver("far", 34.03, -6.8),
                        driver("near", 34.005, -6.8),
                        driver("noPosition", null, null)));

        assertThat(index.query(34.0, -6.8, 5.0, 10)).containsExactly("near", "far");
        assertThat(index.query(34.0, -6.8, 5.0, 1)).containsExactly("near");
        assertThat(meterRegistry.get("geo.index.fallback").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Database down: empty answer, no exception")
    void databaseDown() {
        when(driverRepository.findOnlineWithin(anyDouble(), anyDouble(), anyDouble(), anyDouble()))
                .thenThrow(new QueryTimeoutException("db down"));

        assertThat(index.query(34.0, -6.8, 5.0, 10)).isEmpty();
    }

    @Test
    @DisplayName("distanceTo uses the stored driver position")
    void distanceFromStoredPosition() {
        when(driverRepository.findById("near")).thenReturn(Optional.of(driver("near", 34.009, -6.8)));
        when(driverRepository.findById("unplaced")).thenReturn(Optional.of(driver("unplaced", null, null)));

        assertThat(index.distanceTo("near", 34.0, -6.8).getAsDouble()).isBetween(0.9, 1.1);
        assertThat(index.distanceTo("unplaced", 34.0, -6.8)).isEmpty();
    }

    private static Driver driver(String id, Double lat, Double lng) {
        return Driver.builder().id(id).userId("user-" + id).online(true).currentLat(lat).currentLng(lng).build();
    }
}
