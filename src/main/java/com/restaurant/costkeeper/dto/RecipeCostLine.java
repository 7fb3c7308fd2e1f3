package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One priced line of a recipe: either a raw ingredient or a sub-recipe.
 *
 * @param exactCostCents unrounded cost, {@code null} when the cost is unknown
 */
public record RecipeCostLine(LineKind kind, Long referenceId, String name, BigDecimal quantity,
        BigDecimal exactCostCents, boolean partial) {

    public enum LineKind {
        INGREDIENT, COMPONENT
    }

    public boolean isCostKnown() {
        return exactCostCents != null;
    }

    public Long getRoundedCostCents() {
        return exactCostCents == null ? null : exactCostCents.setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
