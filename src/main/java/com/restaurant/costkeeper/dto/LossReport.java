package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Expiry write-offs over a window, against purchases over the same window.
 */
public record LossReport(int days, LocalDateTime since, List<IngredientLoss> items, long totalLossCents,
        long totalPurchasedCents, BigDecimal wastePercent) {
}
