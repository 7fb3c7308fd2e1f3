package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;

public record IngredientLoss(Long ingredientId, String ingredientName, BigDecimal quantity, long lossCents) {
}
