package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.AbcClass;
import com.restaurant.costkeeper.model.MenuCategory;

import java.math.BigDecimal;

public record DishPerformance(Long dishId, String dishName, MenuCategory category, AbcClass abcClass,
        BigDecimal profitMarginPercent, long salesVolume, long revenueCents, long profitCents,
        BigDecimal revenueSharePercent, BigDecimal cumulativeSharePercent, String recommendation, String strategy) {

    public boolean needsAttention() {
        return category == MenuCategory.PUZZLE || category == MenuCategory.DOG;
    }
}
