package com.ridedispatch.dispatch.config;

import com.ridedispatch.shared.enums.VehicleClass;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tariff per vehicle class. Defaults cover every class; YAML entries override them.
 *
 * <pre>
 * dispatch:
 *   fares:
 *     rates:
 *       CAR: { base-fare: 2.50, per-km: 1.20, per-minute: 0.20, minimum-fare: 5.00 }
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "dispatch.fares")
public class FareProperties {

    private Map<VehicleClass, FareRate> rates = defaultRates();

    public FareRate rateFor(VehicleClass vehicleClass) {
        FareRate rate = rates.get(vehicleClass);
        if (rate == null) {
            throw new IllegalStateException("No fare rate configured for " + vehicleClass);
        }
        return rate;
    }

    public static Map<VehicleClass, FareRate> defaultRates() {
        Map<VehicleClass, FareRate> rates = new EnumMap<>(VehicleClass.class);
        rates.put(VehicleClass.CAR,        FareRate.of("2.50", "1.20", "0.20", "5.00"));
        rates.put(VehicleClass.MOTORCYCLE, FareRate.of("1.50", "0.80", "0.15", "3.00"));
        rates.put(VehicleClass.BICYCLE,    FareRate.of("1.00", "0.50", "0.10", "2.00"));
        rates.put(VehicleClass.SMALL,      FareRate.of("3.00", "1.00", "0.10", "5.00"));
        rates.put(VehicleClass.MEDIUM,     FareRate.of("5.00", "1.50", "0.15", "8.00"));
        rates.put(VehicleClass.LARGE,      FareRate.of("8.00", "2.00", "0.20", "12.00"));
        return rates;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FareRate {
        private BigDecimal baseFare;
        private BigDecimal perKm;
        private BigDecimal perMinute;
        private BigDecimal minimumFare;

        public static FareRate of(String baseFare, String perKm, String perMinute, String minimumFare) {
            return new FareRate(new BigDecimal(baseFare), new BigDecimal(perKm),
                    new BigDecimal(perMinute), new BigDecimal(minimumFare));
        }
    }
}
