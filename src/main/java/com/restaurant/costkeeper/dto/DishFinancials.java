package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.ProfitabilityWarning;

import java.math.BigDecimal;
import java.util.List;

/**
 * Price, cost and derived ratios of one portion. {@code profitMarginPercent + foodCostPercent}
 * is exactly 100.
 */
public record DishFinancials(long sellingPriceCents, long recipeCostCents, long profitCents,
        BigDecimal profitMarginPercent, BigDecimal foodCostPercent, List<ProfitabilityWarning> warnings) {

    public boolean hasWarning(ProfitabilityWarning warning) {
        return warnings.contains(warning);
    }
}
