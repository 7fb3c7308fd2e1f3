package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;

/**
 * @param daysUntilStockout {@code null} when the ingredient had no sales usage in the window
 */
public record StockoutPrediction(Long ingredientId, String ingredientName, BigDecimal remainingQuantity,
        BigDecimal averageDailyUsage, BigDecimal daysUntilStockout) {
}
