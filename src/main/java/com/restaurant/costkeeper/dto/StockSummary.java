package com.restaurant.costkeeper.dto;

import java.util.List;

public record StockSummary(List<IngredientStock> ingredients, long totalValueCents) {
}
