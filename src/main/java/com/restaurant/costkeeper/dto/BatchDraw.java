package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;

/**
 * Quantity taken (or, when simulated, that would be taken) from one batch.
 */
public record BatchDraw(Long batchId, BigDecimal quantity, long unitCostCents) {

    public BigDecimal cost() {
        return quantity.multiply(BigDecimal.valueOf(unitCostCents));
    }
}
