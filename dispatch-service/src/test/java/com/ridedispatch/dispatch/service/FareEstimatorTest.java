package com.ridedispatch.dispatch.service;

import com.ridedispatch.dispatch.config.FareProperties;
import com.ridedispatch.dispatch.model.FareBreakdown;
import com.ridedispatch.shared.enums.VehicleClass;
import com.ridedispatch.shared.util.GeoUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Fare formula:
 *   fare = max(baseFare + distanceKm * perKm + durationMin * perMinute, minimumFare) * surge
 */
class FareEstimatorTest {

    private FareEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new FareEstimator(new FareProperties());
    }

    @Test
    @DisplayName("Surge tiers: <3 drivers 1.5x, <5 drivers 1.2x, otherwise 1.0x")
    void surgeTiers() {
        assertThat(estimator.surgeMultiplier(0)).isEqualTo(1.5);
        assertThat(estimator.surgeMultiplier(2)).isEqualTo(1.5);
        assertThat(estimator.surgeMultiplier(3)).isEqualTo(1.2);
        assertThat(estimator.surgeMultiplier(4)).isEqualTo(1.2);
        assertThat(estimator.surgeMultiplier(5)).isEqualTo(1.0);
        assertThat(estimator.surgeMultiplier(40)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Car trip with six nearby drivers: 2.50 + 5.0km * 1.20 + 10min * 0.20 = 10.50, no surge")
    void carTripWithAmpleSupply() {
        GeoUtils.RouteEstimate route = GeoUtils.estimateRoute(34.0, -6.8, 34.02, -6.83);

        FareBreakdown fare = estimator.calculate(VehicleClass.CAR, route.distanceKm(), route.durationMinutes(), 6);

        assertThat(fare.getSurgeMultiplier()).isEqualTo(1.0);
        assertThat(fare.getBaseFare()).isEqualByComparingTo("2.50");
        assertThat(fare.getDistanceFare()).isEqualByComparingTo("6.00");
        assertThat(fare.getTimeFare()).isEqualByComparingTo("2.00");
        assertThat(fare.isMinimumApplied()).isFalse();
        assertThat(fare.getTotal()).isEqualTo(new BigDecimal("10.50"));
    }

    @Test
    @DisplayName("Two nearby drivers apply the 1.5x surge on top of the subtotal")
    void lowSupplySurge() {
        FareBreakdown fare = estimator.calculate(VehicleClass.CAR, 5.0, 10, 2);

        assertThat(fare.getSurgeMultiplier()).isEqualTo(1.5);
        assertThat(fare.getTotal()).isEqualTo(new BigDecimal("15.75"));
    }

    @Test
    @DisplayName("Short trips are raised to the class minimum before surge")
    void minimumFareApplied() {
        FareBreakdown noSurge = estimator.calculate(VehicleClass.CAR, 0.5, 1, 10);
        FareBreakdown surged = estimator.calculate(VehicleClass.CAR, 0.5, 1, 4);

        assertThat(noSurge.isMinimumApplied()).isTrue();
        assertThat(noSurge.getTotal()).isEqualTo(new BigDecimal("5.00"));
        assertThat(surged.getTotal()).isEqualTo(new BigDecimal("6.00"));
    }

    @Test
    @DisplayName("Delivery classes use their own tariff")
    void deliveryTariff() {
        FareBreakdown large = estimator.calculate(VehicleClass.LARGE, 10.0, 20, 10);

        // 8.00 + 10 * 2.00 + 20 * 0.20
        assertThat(large.getTotal()).isEqualTo(new BigDecimal("32.00"));
    }

    @Test
    @DisplayName("Monetary results always carry two decimals")
    void roundsToCents() {
        FareBreakdown fare = estimator.calculate(VehicleClass.MOTORCYCLE, 3.3, 7, 3);

        // 1.50 + 2.64 + 1.05 = 5.19, * 1.2 = 6.228
        assertThat(fare.getSubtotal()).isEqualTo(new BigDecimal("5.19"));
        assertThat(fare.getTotal()).isEqualTo(new BigDecimal("6.23"));
        assertThat(fare.getTotal().scale()).isEqualTo(2);
    }
}
