package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cost of one full batch of a recipe and of a single serving. Both amounts are rounded
 * half-up once, from {@code exactTotalCents}.
 *
 * @param complete false when at least one ingredient had no stock and was left out of the total
 * @param partial  true when at least one ingredient was priced beyond the stock on hand
 */
public record RecipeCost(Long recipeId, String recipeName, int servings, BigDecimal exactTotalCents,
        long totalCostCents, long costPerServingCents, List<RecipeCostLine> lines, boolean complete,
        boolean partial) {
}
