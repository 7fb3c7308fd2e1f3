package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;

/**
 * Input of the menu classification for one dish over a period.
 */
public record DishSalesFigures(Long dishId, String dishName, BigDecimal profitMarginPercent, long salesVolume,
        long revenueCents, long profitCents) {
}
