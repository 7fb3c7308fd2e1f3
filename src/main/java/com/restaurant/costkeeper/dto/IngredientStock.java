package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;

public record IngredientStock(Long ingredientId, String ingredientName, String unit, BigDecimal remainingQuantity,
        BigDecimal averageUnitCostCents, long valueCents, long activeBatches) {
}
