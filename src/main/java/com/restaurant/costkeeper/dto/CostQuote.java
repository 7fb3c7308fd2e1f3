package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Simulated FIFO cost of a quantity of one ingredient. The cost is kept unrounded so that
 * recipe totals are rounded only once.
 *
 * @param exactCostCents cost in cents, not rounded
 * @param partial        true when stock on hand did not cover the quantity and the shortfall was
 *                       priced at the newest batch's unit cost
 */
public record CostQuote(Long ingredientId, BigDecimal quantity, BigDecimal exactCostCents, List<BatchDraw> draws,
        boolean partial) {

    public long roundedCostCents() {
        return exactCostCents.setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
