package com.ridedispatch.dispatch.service;

import com.ridedispatch.dispatch.config.FareProperties;
import com.ridedispatch.dispatch.model.FareBreakdown;
import com.ridedispatch.shared.enums.VehicleClass;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fare calculation: base fare + per-km + per-minute, floored at the class minimum,
 * then multiplied by a surge factor derived from nearby driver supply.
 *
 * Formula:
 *   fare = max(baseFare + distanceKm * perKm + durationMin * perMinute, minimumFare) * surge
 *
 * Surge: fewer than 3 eligible drivers 1.5x, fewer than 5 1.2x, otherwise 1.0x.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FareEstimator {

    private static final double LOW_SUPPLY_SURGE    = 1.5;
    private static final double MEDIUM_SUPPLY_SURGE = 1.2;
    private static final double NO_SURGE            = 1.0;

    private final FareProperties fareProperties;

    public double surgeMultiplier(int nearbyDrivers) {
        if (nearbyDrivers < 3) {
            return LOW_SUPPLY_SURGE;
        }
        if (nearbyDrivers < 5) {
            return MEDIUM_SUPPLY_SURGE;
        }
        return NO_SURGE;
    }

    public FareBreakdown calculate(VehicleClass vehicleClass, double distanceKm, int durationMinutes, int nearbyDrivers) {
        return calculate(vehicleClass, distanceKm, durationMinutes, surgeMultiplier(nearbyDrivers));
    }

    public FareBreakdown calculate(VehicleClass vehicleClass, double distanceKm, int durationMinutes, double surgeMultiplier) {
        FareProperties.FareRate rate = fareProperties.rateFor(vehicleClass);

        BigDecimal baseFare = scale(rate.getBaseFare());
        BigDecimal distanceFare = scale(BigDecimal.valueOf(distanceKm).multiply(rate.getPerKm()));
        BigDecimal timeFare = scale(BigDecimal.valueOf(durationMinutes).multiply(rate.getPerMinute()));

        BigDecimal raw = baseFare.add(distanceFare).add(timeFare);
        boolean minimumApplied = raw.compareTo(rate.getMinimumFare()) < 0;
        BigDecimal subtotal = scale(minimumApplied ? rate.getMinimumFare() : raw);
        BigDecimal total = scale(subtotal.multiply(BigDecimal.valueOf(surgeMultiplier)));

        log.debug("Fare calc: class={} dist={}km duration={}min surge={} -> {}",
                vehicleClass, distanceKm, durationMinutes, surgeMultiplier, total);

        return FareBreakdown.builder()
                .baseFare(baseFare)
                .distanceFare(distanceFare)
                .timeFare(timeFare)
                .subtotal(subtotal)
                .minimumApplied(minimumApplied)
                .surgeMultiplier(surgeMultiplier)
                .total(total)
                .build();
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
