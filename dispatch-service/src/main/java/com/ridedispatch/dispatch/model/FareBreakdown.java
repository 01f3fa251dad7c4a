package com.ridedispatch.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FareBreakdown {
    private BigDecimal baseFare;
    private BigDecimal distanceFare;
    private BigDecimal timeFare;
    /** Base + distance + time, raised to the class minimum when below it. */
    private BigDecimal subtotal;
    private boolean minimumApplied;
    private double surgeMultiplier;
    private BigDecimal total;
}
