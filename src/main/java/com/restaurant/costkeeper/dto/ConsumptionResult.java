package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public record ConsumptionResult(Long ingredientId, BigDecimal quantity, long totalCostCents, List<BatchDraw> draws) {

    /**
     * Cost per unit weighted by how much was drawn from each batch, in cents with four decimals.
     */
    public BigDecimal weightedUnitCostCents() {
        if (quantity.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal exact = draws.stream().map(BatchDraw::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
        return exact.divide(quantity, 4, RoundingMode.HALF_UP);
    }
}
