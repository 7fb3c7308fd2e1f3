package com.restaurant.costkeeper.dto;

/**
 * Profitability of a dish at current ingredient prices.
 *
 * @param costComplete false when some ingredient had no stock and the cost is understated
 */
public record DishAnalysis(Long dishId, String dishName, DishFinancials financials, boolean costComplete,
        boolean costPartial) {
}
